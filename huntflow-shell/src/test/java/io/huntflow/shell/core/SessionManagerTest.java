package io.huntflow.shell.core;

import static org.junit.jupiter.api.Assertions.*;

import io.huntflow.core.config.HuntflowConfig;
import io.huntflow.core.interpreter.CollectingDisplaySink;
import io.huntflow.shell.core.SessionManager.SessionRef;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class SessionManagerTest {
  private final SessionManager sessions =
      Sessions.inMemory(HuntflowConfig.defaults(), new CollectingDisplaySink());

  @AfterEach
  void closeAll() {
    sessions.closeAll();
  }

  @Test
  void openMakesSessionCurrent() throws Exception {
    SessionRef first = sessions.open(null);
    SessionRef second = sessions.open("triage");
    assertEquals("1", first.label());
    assertEquals("triage", second.label());
    assertEquals("session-1", first.session().id());
    assertEquals("triage", second.session().id());
    assertSame(second, sessions.current().orElseThrow());
    assertEquals(2, sessions.size());
  }

  @Test
  void aliasesMustBeUniqueAndNonNumeric() throws Exception {
    sessions.open("a");
    assertThrows(IllegalArgumentException.class, () -> sessions.open("a"));
    assertThrows(IllegalArgumentException.class, () -> sessions.open("42"));
    assertEquals(1, sessions.size());
  }

  @Test
  void useByIdOrAlias() throws Exception {
    sessions.open("a");
    sessions.open("b");
    assertTrue(sessions.use("1"));
    assertEquals("a", sessions.current().orElseThrow().label());
    assertTrue(sessions.use("b"));
    assertEquals("b", sessions.current().orElseThrow().label());
    assertFalse(sessions.use("c"));
  }

  @Test
  void sessionsKeepSeparateVariables() throws Exception {
    sessions.open("a");
    sessions.execute("x = NEW process [{\"pid\": 1}]");
    sessions.open("b");
    assertFalse(sessions.current().orElseThrow().session().isBound("x"));
    sessions.use("a");
    assertTrue(sessions.current().orElseThrow().session().isBound("x"));
  }

  @Test
  void executeOpensASessionWhenNoneIsOpen() throws Exception {
    sessions.execute("x = NEW process [{\"pid\": 1}]");
    assertEquals(1, sessions.size());
  }

  @Test
  void closingCurrentFallsBackToAnother() throws Exception {
    SessionRef a = sessions.open("a");
    sessions.open("b");
    assertTrue(sessions.close("b"));
    assertEquals("a", sessions.current().orElseThrow().label());
    assertFalse(sessions.close("b"));
    sessions.closeAll();
    assertTrue(sessions.current().isEmpty());
    assertTrue(a.session().isClosed());
  }
}
