package io.huntflow.core.pattern;

import io.huntflow.core.lang.Huntflow.AttributePath;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiled, backend-agnostic filter: a binary tree of AND/OR nodes over comparison and null-test
 * leaves. Paths carry no entity-type qualifier; operands are plain Java values or lists of them.
 */
public sealed interface Predicate
    permits Predicate.And, Predicate.Or, Predicate.Comparison, Predicate.NullTest {

  /** Renders the predicate in huntflow pattern syntax, fully parenthesized. */
  String render();

  record And(Predicate left, Predicate right) implements Predicate {
    @Override
    public String render() {
      return "(" + left.render() + " AND " + right.render() + ")";
    }
  }

  record Or(Predicate left, Predicate right) implements Predicate {
    @Override
    public String render() {
      return "(" + left.render() + " OR " + right.render() + ")";
    }
  }

  /** {@code operand} is a {@code List} for list operators, a scalar (possibly null) otherwise. */
  record Comparison(AttributePath path, Operator operator, boolean negated, Object operand)
      implements Predicate {
    @Override
    public String render() {
      String plain = path + " " + operator.symbol() + " " + renderOperand(operand);
      if (!negated) return plain;
      // symbolic operators take NOT in front of the whole comparison
      return Character.isLetter(operator.symbol().charAt(0))
          ? path + " NOT " + operator.symbol() + " " + renderOperand(operand)
          : "NOT " + plain;
    }

    private static String renderOperand(Object v) {
      if (v instanceof List<?> list) {
        List<String> parts = new ArrayList<>(list.size());
        for (Object o : list) parts.add(renderOperand(o));
        return "(" + String.join(", ", parts) + ")";
      }
      if (v instanceof String s) return "'" + s.replace("'", "\\'") + "'";
      return String.valueOf(v);
    }
  }

  record NullTest(AttributePath path, boolean negated) implements Predicate {
    @Override
    public String render() {
      return path + (negated ? " IS NOT NULL" : " IS NULL");
    }
  }
}
