package io.huntflow.core.store;

import io.huntflow.core.entity.EntityTypes;
import io.huntflow.core.error.SemanticException;
import io.huntflow.core.error.ValidationException;
import io.huntflow.core.lang.Huntflow.AggFunction;
import io.huntflow.core.lang.Huntflow.Aggregation;
import io.huntflow.core.lang.Huntflow.AttributeKey;
import io.huntflow.core.lang.Huntflow.BinKey;
import io.huntflow.core.lang.Huntflow.GroupKey;
import io.huntflow.core.lang.Timespan;
import io.huntflow.core.pattern.Predicate;
import io.huntflow.core.pattern.PredicateEvaluator;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reference {@link StoreAdapter} keeping every row set on the heap.
 *
 * <p>Not thread-safe; a session owns its store.
 */
public final class InMemoryStore implements StoreAdapter {
  private static final Logger LOG = LoggerFactory.getLogger(InMemoryStore.class);

  private record RowSet(String entityType, List<String> columns, List<Map<String, Object>> rows) {}

  private final Map<String, RowSet> rowSets = new HashMap<>();
  private final Map<String, Map<String, Object>> universe = new LinkedHashMap<>();
  private final AtomicLong counter = new AtomicLong();
  private final String prefix;
  private boolean closed;

  public InMemoryStore() {
    this("rs");
  }

  public InMemoryStore(String prefix) {
    this.prefix = prefix;
  }

  @Override
  public RowSetRef materialize(String entityType, List<Map<String, Object>> rows)
      throws ValidationException {
    List<Map<String, Object>> flat = new ArrayList<>(rows.size());
    for (Map<String, Object> r : rows) flat.add(Rows.flatten(r));
    List<String> columns = Rows.columns(flat);
    List<Map<String, Object>> filled = new ArrayList<>(flat.size());
    for (Map<String, Object> r : flat) filled.add(Rows.nullFilled(r, columns));
    if (entityType != null) {
      for (Map<String, Object> r : filled) addToUniverse(entityType, r);
    }
    return register(entityType, columns, filled);
  }

  @Override
  public void ingest(List<Map<String, Object>> entities) throws ValidationException {
    for (Map<String, Object> e : entities) {
      Map<String, Object> flat = Rows.flatten(e);
      Object type = flat.get(EntityTypes.TYPE);
      if (type != null) addToUniverse(type.toString(), flat);
    }
  }

  private void addToUniverse(String entityType, Map<String, Object> row) {
    Object id = row.get(EntityTypes.ID);
    if (id == null) return;
    Map<String, Object> entity = new LinkedHashMap<>(row);
    entity.putIfAbsent(EntityTypes.TYPE, entityType);
    Map<String, Object> existing = universe.get(id.toString());
    if (existing != null) {
      // later observations fill attributes the earlier ones lacked
      for (Map.Entry<String, Object> e : entity.entrySet()) {
        if (e.getValue() != null) existing.put(e.getKey(), e.getValue());
      }
    } else {
      universe.put(id.toString(), entity);
    }
  }

  @Override
  public RowSetRef query(String entityType, Predicate predicate, Timespan.Absolute timespan) {
    List<Map<String, Object>> matched = new ArrayList<>();
    for (Map<String, Object> e : universe.values()) {
      if (!entityType.equals(e.get(EntityTypes.TYPE))) continue;
      if (predicate != null && !PredicateEvaluator.test(predicate, e, this::entity)) continue;
      if (timespan != null && !Rows.observedWithin(e, timespan)) continue;
      matched.add(e);
    }
    List<String> columns = Rows.columns(matched);
    List<Map<String, Object>> filled = new ArrayList<>(matched.size());
    for (Map<String, Object> r : matched) filled.add(Rows.nullFilled(r, columns));
    LOG.debug(
        "query {} matched {} of {} universe entities", entityType, filled.size(), universe.size());
    return register(entityType, columns, filled);
  }

  @Override
  public RowSetRef filter(RowSetRef source, Predicate predicate, Timespan.Absolute timespan)
      throws SemanticException {
    RowSet rs = get(source);
    List<Map<String, Object>> out = new ArrayList<>();
    for (Map<String, Object> r : rs.rows()) {
      if (predicate != null && !PredicateEvaluator.test(predicate, r, this::entity)) continue;
      if (timespan != null && !Rows.observedWithin(r, timespan)) continue;
      out.add(r);
    }
    return register(rs.entityType(), rs.columns(), out);
  }

  @Override
  public RowSetRef timestamped(RowSetRef source) throws SemanticException {
    RowSet rs = get(source);
    requireAttribute(rs, EntityTypes.FIRST_OBSERVED, "TIMESTAMPED");
    List<String> columns = new ArrayList<>();
    columns.add(EntityTypes.FIRST_OBSERVED);
    for (String c : rs.columns()) if (!c.equals(EntityTypes.FIRST_OBSERVED)) columns.add(c);
    List<Map<String, Object>> out = new ArrayList<>();
    for (Map<String, Object> r : rs.rows()) {
      if (r.get(EntityTypes.FIRST_OBSERVED) == null) continue;
      out.add(Rows.nullFilled(r, columns));
    }
    return register(rs.entityType(), columns, out);
  }

  @Override
  public RowSetRef sort(RowSetRef source, String attribute, boolean ascending)
      throws SemanticException {
    RowSet rs = get(source);
    requireAttribute(rs, attribute, "SORT");
    List<Map<String, Object>> out = new ArrayList<>(rs.rows());
    RowSorter.sortByAttribute(out, attribute, ascending);
    return register(rs.entityType(), rs.columns(), out);
  }

  @Override
  public RowSetRef limit(RowSetRef source, int limit) throws SemanticException {
    if (limit < 0) throw new SemanticException("LIMIT must not be negative: " + limit);
    RowSet rs = get(source);
    List<Map<String, Object>> rows = rs.rows();
    return register(rs.entityType(), rs.columns(), rows.subList(0, Math.min(limit, rows.size())));
  }

  @Override
  public RowSetRef offset(RowSetRef source, int offset) throws SemanticException {
    if (offset < 0) throw new SemanticException("OFFSET must not be negative: " + offset);
    RowSet rs = get(source);
    List<Map<String, Object>> rows = rs.rows();
    return register(
        rs.entityType(), rs.columns(), rows.subList(Math.min(offset, rows.size()), rows.size()));
  }

  @Override
  public RowSetRef project(RowSetRef source, List<String> attributes) throws SemanticException {
    RowSet rs = get(source);
    for (String a : attributes) requireAttribute(rs, a, "ATTR");
    List<String> columns = new ArrayList<>(new LinkedHashSet<>(attributes));
    List<Map<String, Object>> out = new ArrayList<>(rs.rows().size());
    for (Map<String, Object> r : rs.rows()) out.add(Rows.nullFilled(r, columns));
    return register(rs.entityType(), columns, out);
  }

  @Override
  public RowSetRef aggregate(RowSetRef source, List<GroupKey> keys, List<Aggregation> aggregations)
      throws SemanticException {
    RowSet rs = get(source);
    for (GroupKey k : keys) {
      requireAttribute(rs, k.attribute(), "GROUP");
      if (k instanceof BinKey bin) {
        if (bin.size() <= 0) {
          throw new SemanticException(
              "BIN size must be positive, got " + bin.size() + " for " + bin.attribute());
        }
        if (bin.unit() != null && bin.size() > Timespan.MAX_WINDOW_SECONDS / bin.unit().seconds()) {
          throw new SemanticException(
              "BIN(" + bin.attribute() + ", " + bin.size() + ", " + bin.unit()
                  + ") exceeds the representable time range");
        }
      }
    }
    for (Aggregation a : aggregations) requireAttribute(rs, a.attribute(), "GROUP");

    Map<List<Object>, List<Map<String, Object>>> groups = new LinkedHashMap<>();
    for (Map<String, Object> r : rs.rows()) {
      List<Object> key = new ArrayList<>(keys.size());
      for (GroupKey k : keys) key.add(keyValue(k, r.get(k.attribute())));
      groups.computeIfAbsent(key, x -> new ArrayList<>()).add(r);
    }
    List<List<Object>> ordered = new ArrayList<>(groups.keySet());
    ordered.sort(InMemoryStore::compareKeys);

    List<String> columns = new ArrayList<>();
    for (GroupKey k : keys) columns.add(k.outputName());
    if (aggregations.isEmpty()) {
      columns.add("count");
    } else {
      for (Aggregation a : aggregations) columns.add(a.outputName());
    }

    List<Map<String, Object>> out = new ArrayList<>(ordered.size());
    for (List<Object> key : ordered) {
      List<Map<String, Object>> members = groups.get(key);
      Map<String, Object> row = new LinkedHashMap<>();
      for (int i = 0; i < keys.size(); i++) row.put(keys.get(i).outputName(), key.get(i));
      if (aggregations.isEmpty()) {
        row.put("count", (long) members.size());
      } else {
        for (Aggregation a : aggregations) {
          row.put(a.outputName(), Aggregates.compute(a.function(), a.attribute(), members));
        }
      }
      out.add(row);
    }
    LOG.debug("grouped {} rows into {} groups", rs.rows().size(), out.size());
    return register(null, columns, out);
  }

  private static Object keyValue(GroupKey key, Object value) throws SemanticException {
    if (key instanceof AttributeKey || value == null) return value;
    BinKey bin = (BinKey) key;
    if (bin.unit() != null) {
      Instant t = Rows.instant(value);
      if (t == null) return null;
      long width = bin.size() * bin.unit().seconds();
      return Instant.ofEpochSecond(Math.floorDiv(t.getEpochSecond(), width) * width).toString();
    }
    Number n = value instanceof Number num ? num : RowSorter.parseNumber(value.toString());
    if (n == null) return null;
    if (n instanceof Long l) {
      try {
        return Math.multiplyExact(Math.floorDiv(l, bin.size()), bin.size());
      } catch (ArithmeticException e) {
        throw new SemanticException(
            "BIN(" + bin.attribute() + ", " + bin.size() + ") overflows for value " + l);
      }
    }
    return Math.floor(n.doubleValue() / bin.size()) * bin.size();
  }

  private static int compareKeys(List<Object> a, List<Object> b) {
    for (int i = 0; i < a.size(); i++) {
      int c = RowSorter.compareValues(a.get(i), b.get(i));
      if (c != 0) return c;
    }
    return 0;
  }

  @Override
  public RowSetRef join(RowSetRef left, RowSetRef right, String leftKey, String rightKey)
      throws SemanticException {
    RowSet l = get(left);
    RowSet r = get(right);
    requireAttribute(l, leftKey, "JOIN");
    requireAttribute(r, rightKey, "JOIN");
    Set<String> leftKinds = kinds(l.rows(), leftKey);
    Set<String> rightKinds = kinds(r.rows(), rightKey);
    if (!leftKinds.isEmpty()
        && !rightKinds.isEmpty()
        && Collections.disjoint(leftKinds, rightKinds)) {
      throw new SemanticException(
          "JOIN keys have incompatible types: " + leftKey + " is " + leftKinds + ", " + rightKey
              + " is " + rightKinds);
    }

    Map<String, List<Map<String, Object>>> index = new HashMap<>();
    for (Map<String, Object> row : r.rows()) {
      Object v = row.get(rightKey);
      if (v != null) index.computeIfAbsent(joinKey(v), x -> new ArrayList<>()).add(row);
    }
    List<String> columns = new ArrayList<>(l.columns());
    for (String c : r.columns()) if (!columns.contains(c)) columns.add(c);
    List<Map<String, Object>> out = new ArrayList<>();
    for (Map<String, Object> row : l.rows()) {
      Object v = row.get(leftKey);
      if (v == null) continue;
      for (Map<String, Object> match : index.getOrDefault(joinKey(v), List.of())) {
        Map<String, Object> joined = new LinkedHashMap<>();
        for (String c : columns) joined.put(c, row.containsKey(c) ? row.get(c) : match.get(c));
        out.add(joined);
      }
    }
    LOG.debug("joined {} x {} rows on {}={}: {} rows", l.rows().size(), r.rows().size(), leftKey,
        rightKey, out.size());
    return register(l.entityType(), columns, out);
  }

  private static Set<String> kinds(List<Map<String, Object>> rows, String key) {
    Set<String> kinds = new HashSet<>();
    for (Map<String, Object> row : rows) {
      Object v = row.get(key);
      if (v != null) kinds.add(kind(v));
    }
    return kinds;
  }

  private static String kind(Object v) {
    if (v instanceof Number) return "number";
    if (v instanceof Boolean) return "boolean";
    if (v instanceof List) return "list";
    return "string";
  }

  private static String joinKey(Object v) {
    if (v instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())) {
      return kind(v) + ":" + n.longValue();
    }
    return kind(v) + ":" + v;
  }

  @Override
  public RowSetRef union(List<RowSetRef> sources) throws SemanticException {
    List<RowSet> sets = new ArrayList<>(sources.size());
    for (RowSetRef ref : sources) sets.add(get(ref));
    String type = sets.isEmpty() ? null : sets.get(0).entityType();
    Set<String> cols = new LinkedHashSet<>();
    for (RowSet rs : sets) cols.addAll(rs.columns());
    List<String> columns = new ArrayList<>(cols);
    Set<Map<String, Object>> unique = new LinkedHashSet<>();
    for (RowSet rs : sets) {
      for (Map<String, Object> r : rs.rows()) unique.add(Rows.nullFilled(r, columns));
    }
    return register(type, columns, new ArrayList<>(unique));
  }

  @Override
  public RowSetDescription describe(RowSetRef source) throws SemanticException {
    RowSet rs = get(source);
    return new RowSetDescription(rs.entityType(), rs.columns(), rs.rows().size());
  }

  @Override
  public List<Map<String, Object>> rows(RowSetRef source) throws SemanticException {
    return Collections.unmodifiableList(get(source).rows());
  }

  @Override
  public Map<String, Object> entity(String id) {
    return universe.get(id);
  }

  @Override
  public void release(RowSetRef source) {
    if (source != null && rowSets.remove(source.id()) != null) {
      LOG.debug("released row set {}", source);
    }
  }

  @Override
  public void close() {
    if (closed) return;
    closed = true;
    LOG.debug("closing store: {} row sets, {} entities", rowSets.size(), universe.size());
    rowSets.clear();
    universe.clear();
  }

  private RowSetRef register(
      String entityType, List<String> columns, List<Map<String, Object>> rows) {
    if (closed) throw new IllegalStateException("Store is closed");
    RowSetRef ref = new RowSetRef(prefix + "-" + counter.incrementAndGet());
    rowSets.put(ref.id(), new RowSet(entityType, List.copyOf(columns), List.copyOf(rows)));
    return ref;
  }

  private RowSet get(RowSetRef ref) throws SemanticException {
    RowSet rs = rowSets.get(Objects.requireNonNull(ref, "ref").id());
    if (rs == null) throw new SemanticException("Unknown or released row set " + ref);
    return rs;
  }

  private static void requireAttribute(RowSet rs, String attribute, String command)
      throws SemanticException {
    if (!rs.columns().contains(attribute)) {
      throw new SemanticException(
          command + ": attribute '" + attribute + "' is not in the schema of "
              + (rs.entityType() != null ? rs.entityType() : "the variable") + " " + rs.columns());
    }
  }

  /** Aggregate functions over one group. */
  static final class Aggregates {
    private Aggregates() {}

    static Object compute(AggFunction fn, String attribute, List<Map<String, Object>> rows)
        throws SemanticException {
      List<Object> values = new ArrayList<>(rows.size());
      for (Map<String, Object> r : rows) {
        Object v = r.get(attribute);
        if (v != null) values.add(v);
      }
      switch (fn) {
        case COUNT:
          return (long) values.size();
        case NUNIQUE:
          Set<String> distinct = new HashSet<>();
          for (Object v : values) distinct.add(joinKey(v));
          return (long) distinct.size();
        case MIN:
        case MAX:
          Object best = null;
          for (Object v : values) {
            int c = best == null ? 0 : RowSorter.compareValues(v, best);
            if (best == null || (fn == AggFunction.MIN ? c < 0 : c > 0)) best = v;
          }
          return best;
        case SUM:
        case AVG:
          if (values.isEmpty()) return null;
          boolean integral = true;
          long lsum = 0;
          double dsum = 0;
          for (Object v : values) {
            Number n = v instanceof Number num ? num : RowSorter.parseNumber(v.toString());
            if (n == null) {
              throw new SemanticException(
                  fn + "(" + attribute + ") needs numeric values, got '" + v + "'");
            }
            if (integral && n instanceof Long l) {
              try {
                lsum = Math.addExact(lsum, l);
              } catch (ArithmeticException e) {
                integral = false;
              }
            } else {
              integral = false;
            }
            dsum += n.doubleValue();
          }
          if (fn == AggFunction.AVG) return dsum / values.size();
          return integral ? (Object) lsum : (Object) dsum;
        default:
          throw new IllegalArgumentException("Unknown aggregate " + fn);
      }
    }
  }
}
