package io.huntflow.shell.core;

import io.huntflow.core.error.HuntflowException;
import io.huntflow.core.interpreter.ExecutionResult;
import io.huntflow.core.interpreter.HuntflowInterpreter;
import io.huntflow.core.session.HuntflowSession;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the huntflow sessions of one shell, allowing new/list/use/close operations. Every session
 * has its own variables and store; huntflows run against the current one.
 *
 * <p>All operations are synchronized, so at most one huntflow runs at a time.
 */
public final class SessionManager {
  private static final Logger LOG = LoggerFactory.getLogger(SessionManager.class);

  /** An open session with the interpreter bound to it. */
  public static final class SessionRef {
    public final int id;
    public final String alias;
    public final HuntflowInterpreter interpreter;

    public SessionRef(int id, String alias, HuntflowInterpreter interpreter) {
      this.id = id;
      this.alias = alias;
      this.interpreter = interpreter;
    }

    public HuntflowSession session() {
      return interpreter.session();
    }

    /** Alias if set, else the numeric id. */
    public String label() {
      return alias != null ? alias : String.valueOf(id);
    }
  }

  /** Creates the interpreter, with a fresh session, for a new session id. */
  @FunctionalInterface
  public interface SessionFactory {
    HuntflowInterpreter create(String sessionId) throws HuntflowException;
  }

  private final SessionFactory factory;
  private final AtomicInteger nextId = new AtomicInteger(1);
  private final Map<Integer, SessionRef> byId = new LinkedHashMap<>();
  private final Map<String, Integer> byAlias = new HashMap<>();
  private Integer currentId = null;

  public SessionManager(SessionFactory factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  /**
   * Opens a new session and makes it current.
   *
   * @param alias optional alias (may be null)
   * @throws IllegalArgumentException if the alias is taken or numeric
   * @throws HuntflowException if the factory cannot set the session up
   */
  public synchronized SessionRef open(String alias) throws HuntflowException {
    if (alias != null) {
      if (byAlias.containsKey(alias)) {
        throw new IllegalArgumentException("Alias already in use: " + alias);
      }
      if (parseId(alias) != null) {
        throw new IllegalArgumentException("Alias must not be a number: " + alias);
      }
    }
    int id = nextId.getAndIncrement();
    HuntflowInterpreter interpreter = factory.create(alias != null ? alias : "session-" + id);
    SessionRef ref = new SessionRef(id, alias, interpreter);
    byId.put(id, ref);
    if (alias != null) {
      byAlias.put(alias, id);
    }
    currentId = id;
    LOG.debug("opened session {}", ref.label());
    return ref;
  }

  public synchronized List<SessionRef> list() {
    return new ArrayList<>(byId.values());
  }

  public synchronized Optional<SessionRef> current() {
    return currentId == null ? Optional.empty() : Optional.ofNullable(byId.get(currentId));
  }

  /** The current session, opening an unnamed one first if there is none. */
  public synchronized SessionRef currentOrOpen() throws HuntflowException {
    Optional<SessionRef> current = current();
    return current.isPresent() ? current.get() : open(null);
  }

  /** Looks a session up by numeric id or alias. */
  public synchronized Optional<SessionRef> get(String idOrAlias) {
    Integer id = parseId(idOrAlias);
    if (id == null) {
      id = byAlias.get(idOrAlias);
    }
    return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
  }

  /** Switches to a session; false if there is none by that id or alias. */
  public synchronized boolean use(String idOrAlias) {
    Optional<SessionRef> ref = get(idOrAlias);
    if (ref.isPresent()) {
      currentId = ref.get().id;
      return true;
    }
    return false;
  }

  /**
   * Runs a huntflow in the current session, opening one if none is open.
   *
   * @throws HuntflowException the failure of the huntflow
   */
  public synchronized ExecutionResult execute(String huntflow) throws HuntflowException {
    return currentOrOpen().interpreter.execute(huntflow);
  }

  /** Closes a session; false if there is none by that id or alias. */
  public synchronized boolean close(String idOrAlias) {
    Optional<SessionRef> ref = get(idOrAlias);
    if (ref.isEmpty()) return false;
    closeById(ref.get().id);
    return true;
  }

  public synchronized void closeAll() {
    for (Integer id : new ArrayList<>(byId.keySet())) {
      closeById(id);
    }
    currentId = null;
  }

  public synchronized int size() {
    return byId.size();
  }

  private void closeById(int id) {
    SessionRef ref = byId.remove(id);
    if (ref != null) {
      if (ref.alias != null) byAlias.remove(ref.alias);
      ref.session().close();
      LOG.debug("closed session {}", ref.label());
    }
    if (Objects.equals(currentId, id)) {
      currentId = byId.isEmpty() ? null : byId.keySet().iterator().next();
    }
  }

  private static Integer parseId(String s) {
    try {
      return Integer.parseInt(s);
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
