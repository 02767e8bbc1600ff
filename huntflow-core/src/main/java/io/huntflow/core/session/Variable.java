package io.huntflow.core.session;

import io.huntflow.core.lang.Huntflow.CommandKind;
import io.huntflow.core.store.RowSetRef;

/**
 * A named handle to a row set of one entity type.
 *
 * @param name variable name, case-sensitive
 * @param entityType entity type of the rows, null when the producing command could not tell
 * @param rows row set in the session's store
 * @param provenance command kind that produced the variable
 */
public record Variable(String name, String entityType, RowSetRef rows, CommandKind provenance) {}
