package io.huntflow.core.store;

/** Opaque handle to a row set held by a {@link StoreAdapter}. */
public record RowSetRef(String id) {
  @Override
  public String toString() {
    return id;
  }
}
