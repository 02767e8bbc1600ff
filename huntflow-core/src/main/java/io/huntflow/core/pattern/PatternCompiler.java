package io.huntflow.core.pattern;

import io.huntflow.core.entity.EntityTypes;
import io.huntflow.core.error.PatternException;
import io.huntflow.core.error.SemanticException;
import io.huntflow.core.lang.Huntflow.AttributePath;
import io.huntflow.core.lang.Huntflow.BinaryPattern;
import io.huntflow.core.lang.Huntflow.ComparisonExpr;
import io.huntflow.core.lang.Huntflow.Connective;
import io.huntflow.core.lang.Huntflow.ListValue;
import io.huntflow.core.lang.Huntflow.Literal;
import io.huntflow.core.lang.Huntflow.NullCheckExpr;
import io.huntflow.core.lang.Huntflow.NullLiteral;
import io.huntflow.core.lang.Huntflow.PatternExpr;
import io.huntflow.core.lang.Huntflow.ScalarValue;
import io.huntflow.core.lang.Huntflow.StringLiteral;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lowers a parsed WHERE pattern into a {@link Predicate}.
 *
 * <p>The parser already builds left-associative trees with AND binding tighter than OR, so the
 * compiler walks the tree left to right and keeps its shape. Each leaf is checked against the
 * subject: the qualifier must name the subject type, the first path segment must be a schema
 * attribute when the schema is known, and the operand must have the shape the operator needs.
 */
public final class PatternCompiler {
  private static final Logger LOG = LoggerFactory.getLogger(PatternCompiler.class);

  private static final java.util.regex.Pattern VARIABLE_REFERENCE =
      java.util.regex.Pattern.compile("([A-Za-z_][A-Za-z0-9_]*)\\.([A-Za-z0-9_\\-.]+)");

  private PatternCompiler() {}

  /**
   * Compiles a pattern.
   *
   * @param expr parsed pattern
   * @param ctx subject type, schema and variable resolution
   * @return compiled predicate
   * @throws SemanticException if the pattern does not fit the subject; {@link PatternException}
   *     for arity, operator and path errors
   */
  public static Predicate compile(PatternExpr expr, CompileContext ctx) throws SemanticException {
    Predicate p = lower(expr, ctx);
    LOG.debug("compiled pattern for {}: {}", ctx.subjectType(), p.render());
    return p;
  }

  private static Predicate lower(PatternExpr expr, CompileContext ctx) throws SemanticException {
    if (expr instanceof BinaryPattern b) {
      Predicate left = lower(b.left(), ctx);
      Predicate right = lower(b.right(), ctx);
      return b.connective() == Connective.AND
          ? new Predicate.And(left, right)
          : new Predicate.Or(left, right);
    }
    if (expr instanceof NullCheckExpr n) {
      return new Predicate.NullTest(resolvePath(n.path(), ctx), n.negated());
    }
    return lowerComparison((ComparisonExpr) expr, ctx);
  }

  private static Predicate lowerComparison(ComparisonExpr c, CompileContext ctx)
      throws SemanticException {
    AttributePath path = resolvePath(c.path(), ctx);
    Operator op = Operator.of(c.op());
    boolean negated = c.negated();

    if (c.value() instanceof ScalarValue sv && sv.bare()) {
      List<Object> referenced = resolveReference(sv, ctx);
      if (referenced != null) {
        switch (op) {
          case EQUALS:
            return new Predicate.Comparison(path, Operator.IN, negated, referenced);
          case NOT_EQUALS:
            return new Predicate.Comparison(path, Operator.IN, !negated, referenced);
          case IN:
          case IS_SUBSET:
          case IS_SUPERSET:
            return new Predicate.Comparison(path, op, negated, referenced);
          default:
            throw new PatternException(
                "Operator " + op.symbol() + " cannot compare " + path + " with variable reference "
                    + sv.literal().toJava());
        }
      }
    }

    switch (op.arity()) {
      case LIST:
        if (!(c.value() instanceof ListValue list)) {
          throw new PatternException(
              "Operator " + c.op().token() + " requires a list value, e.g. " + path + " "
                  + c.op().token() + " (1, 2), but got " + c.value());
        }
        List<Object> items = new ArrayList<>(list.items().size());
        for (Literal l : list.items()) items.add(l.toJava());
        return new Predicate.Comparison(path, op, negated, items);
      case STRING:
        if (!(c.value() instanceof ScalarValue s) || !(s.literal() instanceof StringLiteral str)) {
          throw new PatternException(
              "Operator " + c.op().token() + " requires a string value but got " + c.value());
        }
        if (op == Operator.MATCHES) {
          try {
            java.util.regex.Pattern.compile(str.value());
          } catch (PatternSyntaxException e) {
            throw new PatternException("Invalid regular expression: " + str.value(), e);
          }
        }
        return new Predicate.Comparison(path, op, negated, str.value());
      case SCALAR:
      default:
        if (!(c.value() instanceof ScalarValue s)) {
          throw new PatternException(
              "Operator " + c.op().token() + " requires a single value but got list " + c.value());
        }
        if (op.isOrdering() && s.literal() == NullLiteral.INSTANCE) {
          throw new PatternException("Operator " + c.op().token() + " cannot compare with null");
        }
        return new Predicate.Comparison(path, op, negated, s.literal().toJava());
    }
  }

  /** Strips and checks the qualifier; checks the attribute against the schema if known. */
  private static AttributePath resolvePath(AttributePath path, CompileContext ctx)
      throws PatternException {
    String qualifier = path.qualifier();
    if (qualifier != null && !qualifier.equals(ctx.subjectType())) {
      if (!EntityTypes.isKnown(qualifier)) {
        throw new PatternException("Unknown entity type qualifier '" + qualifier + "' in " + path);
      }
      throw new PatternException(
          "Qualifier '" + qualifier + "' does not match subject type '" + ctx.subjectType()
              + "' in " + path);
    }
    if (ctx.schema() != null && !inSchema(path, ctx)) {
      throw new PatternException(
          "Attribute '" + path.attributeName() + "' is not in the schema of "
              + (ctx.subjectType() != null ? ctx.subjectType() : "the subject")
              + " " + ctx.schema());
    }
    return new AttributePath(null, path.segments());
  }

  /** Some dotted prefix of the path must be a schema attribute; the rest may dereference. */
  private static boolean inSchema(AttributePath path, CompileContext ctx) {
    StringBuilder prefix = new StringBuilder();
    for (int i = 0; i < path.segments().size(); i++) {
      if (i > 0) prefix.append('.');
      prefix.append(path.segments().get(i).name());
      if (ctx.schema().contains(prefix.toString())) return true;
    }
    return false;
  }

  /** Values of {@code var.attr} when the bare operand names a bound variable, else null. */
  private static List<Object> resolveReference(ScalarValue sv, CompileContext ctx)
      throws SemanticException {
    if (ctx.references() == null || !(sv.literal() instanceof StringLiteral s)) return null;
    java.util.regex.Matcher m = VARIABLE_REFERENCE.matcher(s.value());
    if (!m.matches() || !ctx.references().isVariable(m.group(1))) return null;
    return ctx.references().attributeValues(m.group(1), m.group(2));
  }
}
