package io.huntflow.core.interpreter;

import io.huntflow.core.error.SemanticException;
import io.huntflow.core.lang.Huntflow.Expression;
import io.huntflow.core.lang.Huntflow.PatternExpr;
import io.huntflow.core.lang.Huntflow.SortSpec;
import io.huntflow.core.lang.Huntflow.Transform;
import io.huntflow.core.pattern.CompileContext;
import io.huntflow.core.pattern.PatternCompiler;
import io.huntflow.core.pattern.Predicate;
import io.huntflow.core.session.HuntflowSession;
import io.huntflow.core.session.Variable;
import io.huntflow.core.store.RowSetDescription;
import io.huntflow.core.store.RowSetRef;
import io.huntflow.core.store.StoreAdapter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates an expression over a variable for assignments and DISP.
 *
 * <p>Clauses apply in a fixed order: transform, WHERE, SORT, OFFSET/LIMIT, ATTR. Sorting runs
 * before projection, so SORT BY may name any attribute of the variable, projected or not.
 */
final class TransformEvaluator {
  private final HuntflowSession session;

  TransformEvaluator(HuntflowSession session) {
    this.session = session;
  }

  /** Result row set of the expression; the source variable's rows are left untouched. */
  RowSetRef evaluate(Expression expr, Variable source) throws SemanticException {
    StoreAdapter store = session.store();
    List<RowSetRef> intermediate = new ArrayList<>();
    RowSetRef current = source.rows();
    try {
      if (expr.transform() == Transform.TIMESTAMPED) {
        current = step(intermediate, store.timestamped(current));
      }
      Predicate where = null;
      if (expr.where() != null) {
        RowSetDescription d = store.describe(current);
        where = compile(expr.where(), source.entityType(), new HashSet<>(d.attributes()));
      }
      // a filter without predicate copies, so the result never aliases the source
      current = step(intermediate, store.filter(current, where, null));
      if (expr.sort() != null) {
        SortSpec sort = expr.sort();
        current = step(intermediate, store.sort(current, sort.attribute(), sort.ascending()));
      }
      if (expr.offset() != null) {
        current = step(intermediate, store.offset(current, expr.offset()));
      }
      if (expr.limit() != null) {
        current = step(intermediate, store.limit(current, expr.limit()));
      }
      if (!expr.attributes().isEmpty()) {
        current = step(intermediate, store.project(current, expr.attributes()));
      }
      intermediate.remove(current);
      return current;
    } finally {
      for (RowSetRef ref : intermediate) store.release(ref);
    }
  }

  private static RowSetRef step(List<RowSetRef> intermediate, RowSetRef next) {
    intermediate.add(next);
    return next;
  }

  /** Compiles a pattern against a subject, resolving {@code var.attr} operands in the session. */
  Predicate compile(PatternExpr pattern, String subjectType, Set<String> schema)
      throws SemanticException {
    return PatternCompiler.compile(
        pattern, new CompileContext(subjectType, schema, new SessionReferences()));
  }

  private final class SessionReferences implements CompileContext.ReferenceResolver {
    @Override
    public boolean isVariable(String name) {
      return session.isBound(name);
    }

    @Override
    public List<Object> attributeValues(String variable, String attribute)
        throws SemanticException {
      Variable v = session.get(variable);
      RowSetDescription d = session.store().describe(v.rows());
      if (!d.attributes().contains(attribute)) {
        throw new SemanticException(
            "Attribute '" + attribute + "' is not in the schema of variable " + variable + " "
                + d.attributes());
      }
      Set<Object> values = new LinkedHashSet<>();
      for (Map<String, Object> row : session.store().rows(v.rows())) {
        Object value = row.get(attribute);
        if (value != null) values.add(value);
      }
      return new ArrayList<>(values);
    }
  }
}
