package io.huntflow.core.pattern;

import io.huntflow.core.lang.Huntflow.Segment;
import io.huntflow.core.store.RowSorter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Evaluates compiled predicates against flat rows.
 *
 * <p>A path resolves to a set of candidate values: the longest dotted prefix present in the row is
 * looked up, {@code [*]} expands list values, and remaining segments continue into nested maps or
 * through {@code *_ref}/{@code *_refs} attributes via the {@link Dereferencer}. A comparison holds
 * when any candidate satisfies it; {@code NOT} and {@code !=} are exact complements of the
 * positive forms.
 */
public final class PredicateEvaluator {

  /** Looks up a referenced entity by id. */
  @FunctionalInterface
  public interface Dereferencer {
    Map<String, Object> lookup(String id);
  }

  public static final Dereferencer NO_REFERENCES = id -> null;

  private static final Map<String, Pattern> LIKE_CACHE = new ConcurrentHashMap<>();
  private static final Map<String, Pattern> REGEX_CACHE = new ConcurrentHashMap<>();
  private static final int MAX_CACHED = 1024;
  private static final int MAX_DEREF_DEPTH = 8;

  private PredicateEvaluator() {}

  public static boolean test(Predicate p, Map<String, Object> row) {
    return test(p, row, NO_REFERENCES);
  }

  public static boolean test(Predicate p, Map<String, Object> row, Dereferencer refs) {
    if (p instanceof Predicate.And and) {
      return test(and.left(), row, refs) && test(and.right(), row, refs);
    }
    if (p instanceof Predicate.Or or) {
      return test(or.left(), row, refs) || test(or.right(), row, refs);
    }
    if (p instanceof Predicate.NullTest n) {
      boolean anyValue = false;
      for (Object v : resolve(row, n.path().segments(), refs)) {
        if (v != null) {
          anyValue = true;
          break;
        }
      }
      return n.negated() == anyValue;
    }
    Predicate.Comparison c = (Predicate.Comparison) p;
    List<Object> candidates = resolve(row, c.path().segments(), refs);
    boolean positive =
        switch (c.operator()) {
          case NOT_EQUALS -> !anyMatch(candidates, Operator.EQUALS, c.operand());
          case IS_SUBSET, IS_SUPERSET -> setRelation(candidates, c.operator(), c.operand());
          default -> anyMatch(candidates, c.operator(), c.operand());
        };
    return c.negated() != positive;
  }

  /** Candidate values of a path in a row; empty when the attribute is absent. */
  public static List<Object> resolve(
      Map<String, Object> row, List<Segment> segments, Dereferencer refs) {
    List<Object> out = new ArrayList<>();
    resolveInto(row, segments, 0, refs, out, 0);
    return out;
  }

  private static void resolveInto(
      Map<String, Object> node,
      List<Segment> segments,
      int from,
      Dereferencer refs,
      List<Object> out,
      int depth) {
    for (int to = segments.size(); to > from; to--) {
      String key = join(segments, from, to);
      if (!node.containsKey(key)) continue;
      Object value = node.get(key);
      Segment last = segments.get(to - 1);
      List<Object> values = new ArrayList<>();
      if (last.expand() && value instanceof Collection<?> col) {
        values.addAll(col);
      } else {
        values.add(value);
      }
      if (to == segments.size()) {
        out.addAll(values);
        return;
      }
      boolean isRef = key.endsWith("_ref") || key.endsWith("_refs");
      for (Object v : values) {
        descend(v, isRef, segments, to, refs, out, depth);
      }
      return;
    }
  }

  @SuppressWarnings("unchecked")
  private static void descend(
      Object v,
      boolean isRef,
      List<Segment> segments,
      int from,
      Dereferencer refs,
      List<Object> out,
      int depth) {
    if (v instanceof Map<?, ?> m) {
      resolveInto((Map<String, Object>) m, segments, from, refs, out, depth);
    } else if (v instanceof Collection<?> col) {
      // *_refs without [*] still dereferences each element
      for (Object e : col) descend(e, isRef, segments, from, refs, out, depth);
    } else if (isRef && v instanceof String id && depth < MAX_DEREF_DEPTH) {
      Map<String, Object> target = refs.lookup(id);
      if (target != null) resolveInto(target, segments, from, refs, out, depth + 1);
    }
  }

  private static String join(List<Segment> segments, int from, int to) {
    if (to - from == 1) return segments.get(from).name();
    StringBuilder sb = new StringBuilder();
    for (int i = from; i < to; i++) {
      if (i > from) sb.append('.');
      sb.append(segments.get(i).name());
    }
    return sb.toString();
  }

  private static boolean anyMatch(List<Object> candidates, Operator op, Object operand) {
    if (candidates.isEmpty()) {
      return op == Operator.EQUALS && operand == null;
    }
    for (Object candidate : candidates) {
      if (candidate instanceof Collection<?> col) {
        for (Object e : col) if (matches(e, op, operand)) return true;
      } else if (matches(candidate, op, operand)) {
        return true;
      }
    }
    return false;
  }

  private static boolean matches(Object value, Operator op, Object operand) {
    switch (op) {
      case EQUALS:
        return RowSorter.valuesEqual(value, operand);
      case GREATER:
        return value != null && RowSorter.compareValues(value, operand) > 0;
      case LESS:
        return value != null && RowSorter.compareValues(value, operand) < 0;
      case GREATER_OR_EQUAL:
        return value != null && RowSorter.compareValues(value, operand) >= 0;
      case LESS_OR_EQUAL:
        return value != null && RowSorter.compareValues(value, operand) <= 0;
      case IN:
        for (Object o : (List<?>) operand) {
          if (RowSorter.valuesEqual(value, o)) return true;
        }
        return false;
      case LIKE:
        return value != null && like((String) operand).matcher(value.toString()).matches();
      case MATCHES:
        return value != null && regex((String) operand).matcher(value.toString()).find();
      default:
        throw new IllegalArgumentException("Not a scalar operator: " + op);
    }
  }

  /** Set of all non-null candidate values (list candidates are flattened) against the operand. */
  private static boolean setRelation(List<Object> candidates, Operator op, Object operand) {
    Set<String> actual = new HashSet<>();
    for (Object c : candidates) {
      if (c instanceof Collection<?> col) {
        for (Object e : col) if (e != null) actual.add(normalize(e));
      } else if (c != null) {
        actual.add(normalize(c));
      }
    }
    Set<String> expected = new HashSet<>();
    for (Object o : (List<?>) operand) if (o != null) expected.add(normalize(o));
    if (op == Operator.IS_SUBSET) {
      return !actual.isEmpty() && expected.containsAll(actual);
    }
    return !actual.isEmpty() && actual.containsAll(expected);
  }

  private static String normalize(Object v) {
    if (v instanceof Number n) {
      double d = n.doubleValue();
      if (d == Math.rint(d) && !Double.isInfinite(d)) return Long.toString((long) d);
      return Double.toString(d);
    }
    return v.toString();
  }

  /** SQL LIKE: {@code %} any run, {@code _} one character; case-insensitive. */
  static Pattern like(String pattern) {
    Pattern cached = LIKE_CACHE.get(pattern);
    if (cached != null) return cached;
    StringBuilder re = new StringBuilder();
    StringBuilder literal = new StringBuilder();
    for (int i = 0; i < pattern.length(); i++) {
      char ch = pattern.charAt(i);
      if (ch == '%' || ch == '_') {
        if (literal.length() > 0) {
          re.append(Pattern.quote(literal.toString()));
          literal.setLength(0);
        }
        re.append(ch == '%' ? ".*" : ".");
      } else {
        literal.append(ch);
      }
    }
    if (literal.length() > 0) re.append(Pattern.quote(literal.toString()));
    Pattern compiled =
        Pattern.compile(
            re.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    if (LIKE_CACHE.size() < MAX_CACHED) LIKE_CACHE.put(pattern, compiled);
    return compiled;
  }

  private static Pattern regex(String pattern) {
    Pattern cached = REGEX_CACHE.get(pattern);
    if (cached != null) return cached;
    Pattern compiled = Pattern.compile(pattern);
    if (REGEX_CACHE.size() < MAX_CACHED) REGEX_CACHE.put(pattern, compiled);
    return compiled;
  }
}
