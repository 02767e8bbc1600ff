package io.huntflow.core.interpreter;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.huntflow.core.analytics.AnalyticsRegistry;
import io.huntflow.core.analytics.BuiltinAnalytics;
import io.huntflow.core.config.HuntflowConfig;
import io.huntflow.core.connector.ConnectorRegistry;
import io.huntflow.core.connector.DatasourceConnector;
import io.huntflow.core.connector.DatasourceConnector.FetchResult;
import io.huntflow.core.error.DataSourceException;
import io.huntflow.core.error.HuntflowException;
import io.huntflow.core.error.HuntflowSyntaxException;
import io.huntflow.core.error.PatternException;
import io.huntflow.core.error.SemanticException;
import io.huntflow.core.error.ValidationException;
import io.huntflow.core.interpreter.CollectingDisplaySink.InfoDisplay;
import io.huntflow.core.interpreter.CollectingDisplaySink.RowsDisplay;
import io.huntflow.core.interpreter.CollectingDisplaySink.WarningDisplay;
import io.huntflow.core.io.ExtensionFileIO;
import io.huntflow.core.lang.Huntflow;
import io.huntflow.core.lang.Timespan;
import io.huntflow.core.pattern.Predicate;
import io.huntflow.core.session.HuntflowSession;
import io.huntflow.core.session.Variable;
import io.huntflow.core.store.InMemoryStore;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class HuntflowInterpreterTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private static final String PROCS =
      """
      procs = NEW process [{"id": "p1", "name": "explorer.exe", "pid": 1},
                           {"id": "p2", "name": "cmd.exe", "pid": 2, "parent_ref": "p1"}]
      """;

  private final CollectingDisplaySink display = new CollectingDisplaySink();
  private HuntflowSession session;

  @AfterEach
  void close() {
    if (session != null) session.close();
  }

  private HuntflowInterpreter interpreter(
      HuntflowConfig config, DatasourceConnector... connectors) {
    session =
        new HuntflowSession(
            "test",
            new InMemoryStore("test"),
            Clock.fixed(NOW, ZoneOffset.UTC),
            Huntflow.DEFAULT_VARIABLE);
    return new HuntflowInterpreter(
        session,
        new ConnectorRegistry(config, List.of(connectors)),
        new AnalyticsRegistry(config, List.of(new BuiltinAnalytics())),
        new ExtensionFileIO(),
        config,
        display);
  }

  private HuntflowInterpreter interpreter() {
    return interpreter(HuntflowConfig.defaults());
  }

  private static HuntflowConfig withDatasource(String name, String locator) {
    HuntflowConfig d = HuntflowConfig.defaults();
    return new HuntflowConfig(
        Map.of(name, locator), null, Map.of(), Duration.ofSeconds(5), d.applyTimeout(), 100);
  }

  private List<Map<String, Object>> rows(String variable) throws HuntflowException {
    Variable v = session.get(variable);
    return session.store().rows(v.rows());
  }

  private List<Object> column(String variable, String attribute) throws HuntflowException {
    List<Object> out = new ArrayList<>();
    for (Map<String, Object> r : rows(variable)) out.add(r.get(attribute));
    return out;
  }

  private static Map<String, Object> row(Object... kv) {
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
    return m;
  }

  @Test
  void getResolvesLastDaysAgainstSessionClock() throws Exception {
    DatasourceConnector connector = mock(DatasourceConnector.class);
    when(connector.scheme()).thenReturn("mock");
    when(connector.fetch(any(), any(), any(), any()))
        .thenReturn(
            FetchResult.of(List.of(row("type", "process", "id", "process--a", "pid", 7L))));
    HuntflowInterpreter interpreter =
        interpreter(withDatasource("ds1", "mock://hunt"), connector);

    interpreter.execute("procs = GET process FROM ds1 WHERE pid = 7 LAST 7 DAYS");

    Timespan.Absolute expected = new Timespan.Absolute(NOW.minus(Duration.ofDays(7)), NOW);
    verify(connector)
        .fetch(eq("mock://hunt"), eq("process"), any(Predicate.class), eq(expected));
    assertEquals(List.of(7L), column("procs", "pid"));
    assertEquals(Huntflow.CommandKind.GET, session.get("procs").provenance());
  }

  @Test
  void getWithoutFromReusesLastDatasource() throws Exception {
    DatasourceConnector connector = mock(DatasourceConnector.class);
    when(connector.scheme()).thenReturn("mock");
    when(connector.fetch(any(), any(), any(), any())).thenReturn(FetchResult.of(List.of()));
    HuntflowInterpreter interpreter =
        interpreter(withDatasource("ds1", "mock://hunt"), connector);

    interpreter.execute(
        """
        a = GET process FROM ds1 WHERE pid = 1
        b = GET file WHERE name = 'x'
        """);

    verify(connector, times(2)).fetch(eq("mock://hunt"), any(), any(), eq(null));
    assertEquals("ds1", session.lastDatasource());
  }

  @Test
  void getWithoutAnyDatasourceIsSemanticError() {
    HuntflowInterpreter interpreter = interpreter();
    assertThrows(
        SemanticException.class, () -> interpreter.execute("x = GET process WHERE pid = 1"));
  }

  @Test
  void unknownDatasourceIsReported() {
    HuntflowInterpreter interpreter = interpreter();
    DataSourceException e =
        assertThrows(
            DataSourceException.class,
            () -> interpreter.execute("x = GET process FROM ds1 WHERE pid = 1"));
    assertTrue(e.getMessage().contains("ds1"), e.getMessage());
    assertEquals(0, e.getStatementIndex());
    assertTrue(e.describe().startsWith(e.category() + ": "), e.describe());
  }

  @Test
  void connectorFailuresSurfaceAsDataSourceErrors() throws Exception {
    DatasourceConnector connector = mock(DatasourceConnector.class);
    when(connector.scheme()).thenReturn("mock");
    when(connector.fetch(any(), any(), any(), any()))
        .thenThrow(new DataSourceException("connection refused"));
    HuntflowInterpreter interpreter =
        interpreter(withDatasource("ds1", "mock://hunt"), connector);

    DataSourceException e =
        assertThrows(
            DataSourceException.class,
            () -> interpreter.execute("x = GET process FROM ds1 WHERE pid = 1"));
    assertEquals("connection refused", e.getMessage());
    assertFalse(session.isBound("x"));
  }

  @Test
  void assignmentLeavesSourceUntouchedAndIsRepeatable() throws Exception {
    HuntflowInterpreter interpreter = interpreter();
    interpreter.execute(PROCS);
    List<Map<String, Object>> before = rows("procs");

    interpreter.execute("y = procs WHERE pid > 1");
    List<Map<String, Object>> first = rows("y");
    interpreter.execute("y = procs WHERE pid > 1");

    assertEquals(first, rows("y"));
    assertEquals(List.of(2L), column("y", "pid"));
    assertEquals(before, rows("procs"));
  }

  @Test
  void dispOfExpressionEqualsDispOfAssignedVariable() throws Exception {
    HuntflowInterpreter interpreter = interpreter();
    interpreter.execute(PROCS);
    interpreter.execute(
        """
        DISP procs WHERE pid >= 1 ATTR name SORT BY pid DESC LIMIT 5
        tmp = procs WHERE pid >= 1 ATTR name SORT BY pid DESC LIMIT 5
        DISP tmp
        """);
    List<RowsDisplay> shown = display.displays(RowsDisplay.class);
    assertEquals(2, shown.size());
    assertEquals(shown.get(0).rows(), shown.get(1).rows());
    assertEquals(List.of("name"), shown.get(0).columns());
    assertEquals("cmd.exe", shown.get(0).rows().get(0).get("name"));
  }

  @Test
  void sortByAttributeOutsideProjection() throws Exception {
    HuntflowInterpreter interpreter = interpreter();
    interpreter.execute(PROCS);
    interpreter.execute("names = procs ATTR name SORT BY pid DESC");
    assertEquals(List.of("cmd.exe", "explorer.exe"), column("names", "name"));
  }

  @Test
  void dispTruncatesToConfiguredLimit() throws Exception {
    HuntflowConfig d = HuntflowConfig.defaults();
    HuntflowConfig config =
        new HuntflowConfig(Map.of(), null, Map.of(), d.getTimeout(), d.applyTimeout(), 1);
    HuntflowInterpreter interpreter = interpreter(config);
    interpreter.execute(PROCS + "DISP procs");
    RowsDisplay shown = display.displays(RowsDisplay.class).get(0);
    assertEquals(1, shown.rows().size());
    assertEquals(2, shown.total());
  }

  @Test
  void bareCommandsUseTheDefaultVariable() throws Exception {
    HuntflowInterpreter interpreter = interpreter();
    interpreter.execute("NEW ipv4-addr [\"10.0.0.1\", \"10.0.0.2\"]\nDISP");
    assertEquals(List.of("10.0.0.1", "10.0.0.2"), column("_", "value"));
    assertEquals("_", display.displays(RowsDisplay.class).get(0).variable());
  }

  @Test
  void newDerivesStableIds() throws Exception {
    HuntflowInterpreter interpreter = interpreter();
    interpreter.execute(
        """
        a = NEW file [{"name": "x.exe"}]
        b = NEW file [{"name": "x.exe"}]
        """);
    Object id = rows("a").get(0).get("id");
    assertEquals(id, rows("b").get(0).get("id"));
    assertTrue(id.toString().startsWith("file--"), id.toString());
  }

  @Test
  void newRejectsMixedOrUntypedItems() {
    HuntflowInterpreter interpreter = interpreter();
    assertThrows(
        ValidationException.class, () -> interpreter.execute("x = NEW [{\"name\": \"a\"}]"));
    assertThrows(ValidationException.class, () -> interpreter.execute("x = NEW [\"a\"]"));
    assertThrows(ValidationException.class, () -> interpreter.execute("x = NEW []"));
    assertThrows(
        ValidationException.class,
        () -> interpreter.execute("x = NEW file [\"a\", {\"name\": \"b\"}]"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"procs.csv", "procs.json"})
  void saveThenLoadRestoresRows(String fileName, @TempDir Path dir) throws Exception {
    HuntflowInterpreter interpreter = interpreter();
    Path file = dir.resolve(fileName);
    interpreter.execute(PROCS);
    interpreter.execute(
        "SAVE procs TO \"" + file + "\"\nback = LOAD \"" + file + "\" AS process");
    assertEquals(rows("procs"), rows("back"));
    assertEquals("process", session.get("back").entityType());
  }

  @Test
  void loadTakesTypeFromEntities(@TempDir Path dir) throws Exception {
    HuntflowInterpreter interpreter = interpreter();
    Path file = dir.resolve("procs.json");
    interpreter.execute(PROCS + "SAVE procs TO \"" + file + "\"\nback = LOAD \"" + file + "\"");
    assertEquals("process", session.get("back").entityType());
  }

  @Test
  void findWalksParentReferencesBothWays() throws Exception {
    HuntflowInterpreter interpreter = interpreter();
    interpreter.execute(
        PROCS
            + """
            kids = procs WHERE name = 'cmd.exe'
            parents = FIND process CREATED kids
            children = FIND process CREATED BY parents
            """);
    assertEquals(List.of("p1"), column("parents", "id"));
    assertEquals(List.of("p2"), column("children", "id"));
  }

  @Test
  void findBetweenUnrelatedTypesIsSemanticError() throws Exception {
    HuntflowInterpreter interpreter = interpreter();
    interpreter.execute(PROCS);
    SemanticException e =
        assertThrows(
            SemanticException.class,
            () -> interpreter.execute("x = FIND email-message CREATED procs"));
    assertTrue(e.getMessage().contains("No relation"), e.getMessage());
    assertThrows(
        SemanticException.class, () -> interpreter.execute("x = FIND process ATE procs"));
  }

  @Test
  void joinAndGroupThroughStatements() throws Exception {
    HuntflowInterpreter interpreter = interpreter();
    interpreter.execute(
        """
        x = NEW process [{"id": "a", "pid": 1}]
        y = NEW process [{"id": "b", "pid": 50, "ppid": 1}, {"id": "c", "pid": 51, "ppid": 1}]
        none = JOIN x, y
        pairs = JOIN x, y BY pid, ppid
        counts = GROUP y BY ppid
        """);
    assertTrue(rows("none").isEmpty());
    assertEquals(2, rows("pairs").size());
    assertEquals(List.of(row("ppid", 1L, "count", 2L)), rows("counts"));
    assertNull(session.get("counts").entityType());
    assertEquals("process", session.get("pairs").entityType());
  }

  @Test
  void groupedRowsDoNotMergeWithEntities() throws Exception {
    HuntflowInterpreter interpreter = interpreter();
    interpreter.execute(PROCS + "counts = GROUP procs BY name");
    SemanticException e =
        assertThrows(SemanticException.class, () -> interpreter.execute("all = procs + counts"));
    assertTrue(e.getMessage().contains("incompatible"), e.getMessage());
    assertThrows(
        SemanticException.class,
        () -> interpreter.execute("kids = FIND process CREATED BY counts"));
    interpreter.execute("again = counts + counts");
    assertEquals(2, rows("again").size());
  }

  @Test
  void mergeRequiresOneEntityType() throws Exception {
    HuntflowInterpreter interpreter = interpreter();
    interpreter.execute(PROCS + "files = NEW file [{\"name\": \"a\"}]");
    assertThrows(SemanticException.class, () -> interpreter.execute("all = procs + files"));
    interpreter.execute("again = procs + procs");
    assertEquals(2, rows("again").size());
  }

  @Test
  void oversizedRelativeWindowFailsBeforeExecution() throws Exception {
    HuntflowInterpreter interpreter = interpreter();
    interpreter.execute(PROCS);
    HuntflowSyntaxException e =
        assertThrows(
            HuntflowSyntaxException.class,
            () -> interpreter.execute("k = FIND process CREATED procs LAST 1000000000000 DAYS"));
    assertEquals("SyntaxError", e.category());
    assertFalse(session.isBound("k"));
  }

  @Test
  void sortCommandBindsSortedCopy() throws Exception {
    HuntflowInterpreter interpreter = interpreter();
    interpreter.execute(PROCS + "desc = SORT procs BY pid DESC\nSORT procs BY name");
    assertEquals(List.of(2L, 1L), column("desc", "pid"));
    assertEquals(List.of("cmd.exe", "explorer.exe"), column("_", "name"));
    assertEquals(List.of(1L, 2L), column("procs", "pid"));
  }

  @Test
  void timestampedPutsFirstObservedFirstAndDropsUntimedRows() throws Exception {
    HuntflowInterpreter interpreter = interpreter();
    interpreter.execute(
        PROCS
            + """
            seen = NEW process [{"name": "a", "first_observed": "2026-02-28T10:00:00Z"},
                                {"name": "b"}]
            ts = TIMESTAMPED(seen)
            """);
    List<Map<String, Object>> ts = rows("ts");
    assertEquals(1, ts.size());
    assertEquals("first_observed", ts.get(0).keySet().iterator().next());
    assertEquals("a", ts.get(0).get("name"));
    assertThrows(SemanticException.class, () -> interpreter.execute("TIMESTAMPED(procs)"));
  }

  @Test
  void applyReplacesInputRowsAndShowsWarnings() throws Exception {
    HuntflowInterpreter interpreter = interpreter();
    interpreter.execute(PROCS);
    interpreter.execute("APPLY builtin://tag ON procs WITH value=bad");
    assertEquals(List.of("bad", "bad"), column("procs", "x_tag"));
    assertEquals(Huntflow.CommandKind.APPLY, session.get("procs").provenance());

    interpreter.execute("APPLY builtin://sample ON procs WITH n=5");
    assertEquals(1, display.displays(WarningDisplay.class).size());
    assertEquals(2, rows("procs").size());
  }

  @Test
  void unknownAnalyticsFails() throws Exception {
    HuntflowInterpreter interpreter = interpreter();
    interpreter.execute(PROCS);
    HuntflowException e =
        assertThrows(
            HuntflowException.class, () -> interpreter.execute("APPLY nope://x ON procs"));
    assertEquals("AnalyticsError", e.category());
  }

  @Test
  void infoDescribesVariable() throws Exception {
    HuntflowInterpreter interpreter = interpreter();
    interpreter.execute(PROCS + "INFO procs");
    DisplaySink.VariableInfo info = display.displays(InfoDisplay.class).get(0).info();
    assertEquals("procs", info.name());
    assertEquals("process", info.entityType());
    assertEquals("NEW", info.provenance());
    assertEquals(2, info.rowCount());
    assertTrue(info.attributes().contains("parent_ref"));
  }

  @Test
  void failedStatementKeepsEarlierBindings() throws Exception {
    HuntflowInterpreter interpreter = interpreter();
    PatternException e =
        assertThrows(
            PatternException.class,
            () -> interpreter.execute(PROCS + "bad = procs WHERE nope = 1\nlater = procs"));
    assertEquals(1, e.getStatementIndex());
    assertTrue(session.isBound("procs"));
    assertFalse(session.isBound("bad"));
    assertFalse(session.isBound("later"));
  }

  @Test
  void executionResultListsBoundVariables() throws Exception {
    HuntflowInterpreter interpreter = interpreter();
    ExecutionResult result = interpreter.execute(PROCS + "y = procs\ny = procs LIMIT 1\nDISP y");
    assertEquals(4, result.statements());
    assertEquals(List.of("procs", "y"), result.boundVariables());
  }
}
