package io.huntflow.core.store;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/** Sorting and value comparison shared by the store, the evaluator and GROUP. */
public final class RowSorter {

  private RowSorter() {}

  /**
   * Sort rows in place by a specific attribute. Rows missing the attribute sort first when
   * ascending; the sort is stable.
   *
   * @param rows the rows to sort
   * @param attribute the attribute name to sort by
   * @param ascending true for ascending order, false for descending
   */
  public static void sortByAttribute(
      List<Map<String, Object>> rows, String attribute, boolean ascending) {
    if (rows == null || rows.isEmpty()) return;

    Comparator<Map<String, Object>> comparator =
        (a, b) -> compareValues(a.get(attribute), b.get(attribute));
    if (!ascending) {
      comparator = comparator.reversed();
    }
    rows.sort(comparator);
  }

  /**
   * Compare two values. Handles nulls, numbers (across Long/Double), numeric strings against
   * numbers, and comparable types; everything else compares by string form.
   *
   * @return negative if a &lt; b, positive if a &gt; b, zero if equal
   */
  @SuppressWarnings("unchecked")
  public static int compareValues(Object a, Object b) {
    if (a == null && b == null) return 0;
    if (a == null) return -1;
    if (b == null) return 1;

    if (a instanceof Number na && b instanceof Number nb) {
      return compareNumbers(na, nb);
    }
    // '10' against 10 compares numerically
    if (a instanceof Number na && b instanceof String sb) {
      Number nb = parseNumber(sb);
      if (nb != null) return compareNumbers(na, nb);
    }
    if (a instanceof String sa && b instanceof Number nb) {
      Number na = parseNumber(sa);
      if (na != null) return compareNumbers(na, nb);
    }

    if (a instanceof Comparable && a.getClass().isInstance(b)) {
      return ((Comparable<Object>) a).compareTo(b);
    }

    return a.toString().compareTo(b.toString());
  }

  /** Equality with the same coercions as {@link #compareValues}. */
  public static boolean valuesEqual(Object a, Object b) {
    if (a == null || b == null) return a == b;
    if (a instanceof Boolean || b instanceof Boolean) {
      return a.toString().equalsIgnoreCase(b.toString());
    }
    return compareValues(a, b) == 0;
  }

  private static int compareNumbers(Number a, Number b) {
    if (isIntegral(a) && isIntegral(b)) return Long.compare(a.longValue(), b.longValue());
    return Double.compare(a.doubleValue(), b.doubleValue());
  }

  private static boolean isIntegral(Number n) {
    return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
  }

  /** Parses a numeric string as Long or Double, or returns null. */
  public static Number parseNumber(String s) {
    if (s == null || s.isEmpty()) return null;
    try {
      return Long.parseLong(s);
    } catch (NumberFormatException ignore) {
      // not integral
    }
    char c = s.charAt(0);
    if (!(Character.isDigit(c) || c == '-' || c == '+' || c == '.')) return null;
    try {
      double d = Double.parseDouble(s);
      return Double.isFinite(d) ? d : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
