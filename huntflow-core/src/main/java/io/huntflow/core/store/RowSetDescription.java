package io.huntflow.core.store;

import java.util.List;

/**
 * Schema and size of a row set.
 *
 * @param entityType entity type of the rows, null if untyped
 * @param attributes attribute names in column order
 * @param rowCount number of rows
 */
public record RowSetDescription(String entityType, List<String> attributes, long rowCount) {
  public RowSetDescription {
    attributes = List.copyOf(attributes);
  }
}
