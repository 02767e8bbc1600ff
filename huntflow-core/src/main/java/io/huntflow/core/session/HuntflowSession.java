package io.huntflow.core.session;

import io.huntflow.core.error.SemanticException;
import io.huntflow.core.lang.Huntflow;
import io.huntflow.core.store.RowSetRef;
import io.huntflow.core.store.StoreAdapter;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of one huntflow execution: the variables bound so far, the store holding their rows, the
 * default variable name and the datasource last used by GET.
 *
 * <p>Not thread-safe. Callers sharing a session must serialize access.
 */
public final class HuntflowSession implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(HuntflowSession.class);

  private final String id;
  private final StoreAdapter store;
  private final Clock clock;
  private final String defaultVariable;
  private final TimeoutGuard timeouts;
  private final Map<String, Variable> variables = new LinkedHashMap<>();
  private String lastDatasource;
  private boolean closed;

  public HuntflowSession(String id, StoreAdapter store) {
    this(id, store, Clock.systemUTC(), Huntflow.DEFAULT_VARIABLE);
  }

  public HuntflowSession(String id, StoreAdapter store, Clock clock, String defaultVariable) {
    this.id = id;
    this.store = store;
    this.clock = clock;
    this.defaultVariable = defaultVariable;
    this.timeouts = new TimeoutGuard(id);
  }

  public String id() {
    return id;
  }

  public StoreAdapter store() {
    return store;
  }

  /** Clock relative timespans resolve against. */
  public Clock clock() {
    return clock;
  }

  public String defaultVariable() {
    return defaultVariable;
  }

  public TimeoutGuard timeouts() {
    return timeouts;
  }

  public String lastDatasource() {
    return lastDatasource;
  }

  public void setLastDatasource(String locator) {
    this.lastDatasource = locator;
  }

  /**
   * Binds a variable, replacing any previous binding of the name. The replaced row set is
   * released unless another variable still refers to it.
   */
  public void bind(Variable variable) {
    ensureOpen();
    Variable previous = variables.put(variable.name(), variable);
    if (previous != null
        && !previous.rows().equals(variable.rows())
        && !referenced(previous.rows())) {
      store.release(previous.rows());
    }
    LOG.debug(
        "session {}: bound {} ({}, from {})",
        id,
        variable.name(),
        variable.entityType(),
        variable.provenance());
  }

  private boolean referenced(RowSetRef ref) {
    for (Variable v : variables.values()) {
      if (v.rows().equals(ref)) return true;
    }
    return false;
  }

  /**
   * Looks up a bound variable.
   *
   * @throws SemanticException if the name is not bound
   */
  public Variable get(String name) throws SemanticException {
    Variable v = variables.get(name);
    if (v == null) {
      throw new SemanticException(
          "Variable '" + name + "' is not defined"
              + (variables.isEmpty() ? "" : "; defined: " + String.join(", ", variables.keySet())));
    }
    return v;
  }

  public boolean isBound(String name) {
    return variables.containsKey(name);
  }

  /** Bound variable names in binding order. */
  public Set<String> variableNames() {
    return Collections.unmodifiableSet(variables.keySet());
  }

  public List<Variable> variables() {
    return new ArrayList<>(variables.values());
  }

  public boolean isClosed() {
    return closed;
  }

  /** Releases every row set, closes the store and stops the call worker. */
  @Override
  public void close() {
    if (closed) return;
    closed = true;
    for (Variable v : variables.values()) store.release(v.rows());
    variables.clear();
    try {
      store.close();
    } finally {
      timeouts.close();
    }
    LOG.debug("session {} closed", id);
  }

  private void ensureOpen() {
    if (closed) throw new IllegalStateException("Session " + id + " is closed");
  }
}
