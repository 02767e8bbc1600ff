package io.huntflow.core.store;

import io.huntflow.core.entity.EntityTypes;
import io.huntflow.core.error.ValidationException;
import io.huntflow.core.lang.HuntflowParser;
import io.huntflow.core.lang.Timespan;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Row helpers: flattening, value normalization and observation windows. */
public final class Rows {
  private Rows() {}

  /**
   * Flattens nested maps into dotted attribute names and normalizes values to null, Boolean,
   * Long, Double, String or List of these. Maps inside lists are kept as maps.
   */
  public static Map<String, Object> flatten(Map<String, ?> row) throws ValidationException {
    Map<String, Object> out = new LinkedHashMap<>();
    flattenInto("", row, out);
    return out;
  }

  private static void flattenInto(String prefix, Map<String, ?> node, Map<String, Object> out)
      throws ValidationException {
    for (Map.Entry<String, ?> e : node.entrySet()) {
      String key = prefix + e.getKey();
      Object v = e.getValue();
      if (v instanceof Map<?, ?> m) {
        flattenInto(key + ".", asStringMap(m), out);
      } else {
        out.put(key, normalize(v));
      }
    }
  }

  private static Map<String, Object> asStringMap(Map<?, ?> m) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<?, ?> e : m.entrySet()) copy.put(String.valueOf(e.getKey()), e.getValue());
    return copy;
  }

  /** Normalizes one value; whole doubles stay doubles, integral types become Long. */
  public static Object normalize(Object v) throws ValidationException {
    if (v == null || v instanceof String || v instanceof Boolean || v instanceof Long
        || v instanceof Double) {
      return v;
    }
    if (v instanceof Integer || v instanceof Short || v instanceof Byte) {
      return ((Number) v).longValue();
    }
    if (v instanceof Float f) return f.doubleValue();
    if (v instanceof BigInteger bi) return bi.longValue();
    if (v instanceof BigDecimal bd) return bd.doubleValue();
    if (v instanceof Number n) return n.doubleValue();
    if (v instanceof Instant i) return i.toString();
    if (v instanceof Character c) return c.toString();
    if (v instanceof Collection<?> col) {
      List<Object> list = new ArrayList<>(col.size());
      for (Object o : col) {
        list.add(o instanceof Map<?, ?> m ? flatten(asStringMap(m)) : normalize(o));
      }
      return list;
    }
    throw new ValidationException(
        "Unsupported attribute value of type " + v.getClass().getSimpleName() + ": " + v);
  }

  /** Union of attribute names in first-appearance order. */
  public static List<String> columns(List<Map<String, Object>> rows) {
    Set<String> cols = new LinkedHashSet<>();
    for (Map<String, Object> r : rows) cols.addAll(r.keySet());
    return new ArrayList<>(cols);
  }

  /** Copy of the row with every column present, missing ones null. */
  public static Map<String, Object> nullFilled(Map<String, Object> row, List<String> columns) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (String c : columns) out.put(c, row.get(c));
    return out;
  }

  /** Parses a timestamp attribute value (ISO string or epoch seconds), or null. */
  public static Instant instant(Object v) {
    if (v instanceof Number n) return Instant.ofEpochSecond(n.longValue());
    if (v instanceof String s) return HuntflowParser.parseInstant(s);
    return null;
  }

  /**
   * Whether the row was observed within the window. The row interval runs from {@code
   * first_observed} to {@code last_observed}, either bound standing in for a missing other;
   * rows with neither never match.
   */
  public static boolean observedWithin(Map<String, Object> row, Timespan.Absolute window) {
    Instant first = instant(row.get(EntityTypes.FIRST_OBSERVED));
    Instant last = instant(row.get(EntityTypes.LAST_OBSERVED));
    if (first == null && last == null) return false;
    if (first == null) first = last;
    if (last == null) last = first;
    return window.overlaps(first, last);
  }
}
