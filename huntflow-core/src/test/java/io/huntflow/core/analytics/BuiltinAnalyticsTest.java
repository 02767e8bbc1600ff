package io.huntflow.core.analytics;

import static org.junit.jupiter.api.Assertions.*;

import io.huntflow.core.analytics.AnalyticsRunner.AnalyticsInput;
import io.huntflow.core.analytics.AnalyticsRunner.AnalyticsResult;
import io.huntflow.core.error.AnalyticsException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BuiltinAnalyticsTest {
  private final BuiltinAnalytics builtin = new BuiltinAnalytics();

  private static final AnalyticsInput PROCS =
      new AnalyticsInput(
          "procs",
          "process",
          List.of("pid"),
          List.of(Map.of("pid", 1L), Map.of("pid", 2L), Map.of("pid", 3L)));

  @Test
  void tagAddsAttributeToEveryRow() throws Exception {
    AnalyticsResult r =
        builtin.invoke("builtin://tag", List.of(PROCS), Map.of("attribute", "verdict"));
    List<Map<String, Object>> rows = r.outputs().get("procs");
    assertEquals(3, rows.size());
    for (Map<String, Object> row : rows) assertEquals("suspicious", row.get("verdict"));
    assertTrue(r.warnings().isEmpty());
  }

  @Test
  void sampleKeepsFirstRows() throws Exception {
    AnalyticsResult r = builtin.invoke("builtin:sample", List.of(PROCS), Map.of("n", "2"));
    assertEquals(List.of(Map.of("pid", 1L), Map.of("pid", 2L)), r.outputs().get("procs"));
    assertTrue(r.warnings().isEmpty());

    r = builtin.invoke("builtin://sample", List.of(PROCS), Map.of());
    assertEquals(3, r.outputs().get("procs").size());
    assertEquals(1, r.warnings().size());
  }

  @Test
  void sampleRejectsBadCounts() {
    assertThrows(
        AnalyticsException.class,
        () -> builtin.invoke("builtin://sample", List.of(PROCS), Map.of("n", "many")));
    assertThrows(
        AnalyticsException.class,
        () -> builtin.invoke("builtin://sample", List.of(PROCS), Map.of("n", "-1")));
  }

  @Test
  void summaryOnlyDisplays() throws Exception {
    AnalyticsResult r = builtin.invoke("builtin://SUMMARY", List.of(PROCS), Map.of());
    assertTrue(r.outputs().isEmpty());
    assertEquals("procs: process, 3 rows, attributes pid", r.display());
  }

  @Test
  void unknownBuiltin() {
    AnalyticsException e =
        assertThrows(
            AnalyticsException.class,
            () -> builtin.invoke("builtin://cluster", List.of(PROCS), Map.of()));
    assertTrue(e.getMessage().contains("available: tag, sample, summary"), e.getMessage());
  }
}
