package io.huntflow.core.store;

import io.huntflow.core.error.SemanticException;
import io.huntflow.core.error.ValidationException;
import io.huntflow.core.lang.Huntflow.Aggregation;
import io.huntflow.core.lang.Huntflow.GroupKey;
import io.huntflow.core.lang.Timespan;
import io.huntflow.core.pattern.Predicate;
import java.util.List;
import java.util.Map;

/**
 * Storage backend holding the rows behind session variables.
 *
 * <p>Every operation producing rows returns a new {@link RowSetRef}; inputs are never modified.
 * Rows of typed row sets that carry an {@code id} also enter the store's entity universe, which
 * backs {@link #query}, FIND traversals and reference dereferencing.
 */
public interface StoreAdapter extends AutoCloseable {

  /**
   * Materializes rows into a new row set. Nested maps are flattened into dotted attributes and
   * every row is null-filled to the union of attributes.
   *
   * @param entityType type of the rows, may be null for untyped results
   * @throws ValidationException if a value cannot be stored
   */
  RowSetRef materialize(String entityType, List<Map<String, Object>> rows)
      throws ValidationException;

  /** Adds entities to the universe without creating a row set, e.g. referenced objects. */
  void ingest(List<Map<String, Object>> entities) throws ValidationException;

  /**
   * Entities of a type from the universe.
   *
   * @param predicate filter, or null for all
   * @param timespan observation window, or null for any time
   */
  RowSetRef query(String entityType, Predicate predicate, Timespan.Absolute timespan)
      throws SemanticException;

  /** Rows of {@code source} matching the predicate (nullable) and window (nullable). */
  RowSetRef filter(RowSetRef source, Predicate predicate, Timespan.Absolute timespan)
      throws SemanticException;

  /** Rows with a {@code first_observed} timestamp, that attribute first. */
  RowSetRef timestamped(RowSetRef source) throws SemanticException;

  RowSetRef sort(RowSetRef source, String attribute, boolean ascending) throws SemanticException;

  RowSetRef limit(RowSetRef source, int limit) throws SemanticException;

  RowSetRef offset(RowSetRef source, int offset) throws SemanticException;

  RowSetRef project(RowSetRef source, List<String> attributes) throws SemanticException;

  /** Groups rows by the keys and computes the aggregations per group. */
  RowSetRef aggregate(RowSetRef source, List<GroupKey> keys, List<Aggregation> aggregations)
      throws SemanticException;

  /**
   * Inner join on {@code left.leftKey == right.rightKey}. The result has the left type and the
   * left attributes followed by right attributes the left side lacks.
   */
  RowSetRef join(RowSetRef left, RowSetRef right, String leftKey, String rightKey)
      throws SemanticException;

  /** Set union of rows with identical attribute values removed. */
  RowSetRef union(List<RowSetRef> sources) throws SemanticException;

  RowSetDescription describe(RowSetRef source) throws SemanticException;

  /** Rows of a row set in order; the returned maps must not be modified. */
  List<Map<String, Object>> rows(RowSetRef source) throws SemanticException;

  /** Universe entity with the given id, or null. */
  Map<String, Object> entity(String id);

  /** Drops a row set; unknown references are ignored. */
  void release(RowSetRef source);

  @Override
  void close();
}
