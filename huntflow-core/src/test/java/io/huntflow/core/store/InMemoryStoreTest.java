package io.huntflow.core.store;

import static org.junit.jupiter.api.Assertions.*;

import io.huntflow.core.error.SemanticException;
import io.huntflow.core.lang.Huntflow.AggFunction;
import io.huntflow.core.lang.Huntflow.Aggregation;
import io.huntflow.core.lang.Huntflow.AttributeKey;
import io.huntflow.core.lang.Huntflow.BinKey;
import io.huntflow.core.lang.Huntflow.GroupKey;
import io.huntflow.core.lang.Huntflow.TimeUnitName;
import io.huntflow.core.lang.HuntflowParser;
import io.huntflow.core.lang.Timespan;
import io.huntflow.core.pattern.CompileContext;
import io.huntflow.core.pattern.PatternCompiler;
import io.huntflow.core.pattern.Predicate;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class InMemoryStoreTest {
  private final InMemoryStore store = new InMemoryStore("t");

  @AfterEach
  void close() {
    store.close();
  }

  private static Map<String, Object> row(Object... kv) {
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
    return m;
  }

  private static Predicate where(String pattern) throws Exception {
    return PatternCompiler.compile(
        HuntflowParser.parsePattern(pattern), CompileContext.forType("process"));
  }

  private RowSetRef processes() throws Exception {
    return store.materialize(
        "process",
        List.of(
            row("id", "process--1", "name", "b.exe", "pid", 20L),
            row("id", "process--2", "name", "a.exe", "pid", 10L),
            row("id", "process--3", "name", "c.exe", "pid", 30L, "ppid", 10L)));
  }

  @Test
  void materializeUnionsAndNullFillsColumns() throws Exception {
    RowSetRef ref = processes();
    RowSetDescription d = store.describe(ref);
    assertEquals("process", d.entityType());
    assertEquals(List.of("id", "name", "pid", "ppid"), d.attributes());
    assertEquals(3, d.rowCount());
    assertTrue(store.rows(ref).get(0).containsKey("ppid"));
    assertNull(store.rows(ref).get(0).get("ppid"));
  }

  @Test
  void nestedObjectsAreFlattened() throws Exception {
    RowSetRef ref =
        store.materialize(
            "file", List.of(row("name", "a", "hashes", row("MD5", "x", "SHA-256", "y"))));
    assertEquals(List.of("name", "hashes.MD5", "hashes.SHA-256"), store.describe(ref).attributes());
  }

  @Test
  void sortOffsetLimitProject() throws Exception {
    RowSetRef sorted = store.sort(processes(), "pid", false);
    RowSetRef page = store.limit(store.offset(sorted, 1), 1);
    RowSetRef projected = store.project(page, List.of("name"));
    assertEquals(List.of(row("name", "b.exe")), store.rows(projected));
  }

  @Test
  void sortingOnUnknownAttributeIsSemanticError() throws Exception {
    RowSetRef ref = processes();
    SemanticException e =
        assertThrows(SemanticException.class, () -> store.sort(ref, "nope", true));
    assertTrue(e.getMessage().startsWith("SORT: attribute 'nope'"), e.getMessage());
    assertThrows(SemanticException.class, () -> store.project(ref, List.of("nope")));
  }

  @Test
  void filterAppliesPredicate() throws Exception {
    RowSetRef ref = store.filter(processes(), where("pid >= 20"), null);
    assertEquals(2, store.describe(ref).rowCount());
  }

  @Test
  void queryServesTheEntityUniverse() throws Exception {
    processes();
    RowSetRef ref = store.query("process", where("name LIKE '%.exe'"), null);
    assertEquals(3, store.describe(ref).rowCount());
    assertEquals(0, store.describe(store.query("file", null, null)).rowCount());
    assertEquals("a.exe", store.entity("process--2").get("name"));
  }

  @Test
  void timespanKeepsOverlappingObservations() throws Exception {
    RowSetRef ref =
        store.materialize(
            "process",
            List.of(
                row("pid", 1L, "first_observed", "2021-01-01T00:00:00Z"),
                row(
                    "pid",
                    2L,
                    "first_observed",
                    "2020-12-31T00:00:00Z",
                    "last_observed",
                    "2021-01-01T10:00:00Z"),
                row("pid", 3L, "first_observed", "2021-02-01T00:00:00Z"),
                row("pid", 4L)));
    Timespan.Absolute window =
        new Timespan.Absolute(
            Instant.parse("2021-01-01T00:00:00Z"), Instant.parse("2021-01-02T00:00:00Z"));
    List<Object> pids = new ArrayList<>();
    for (Map<String, Object> r : store.rows(store.filter(ref, null, window))) {
      pids.add(r.get("pid"));
    }
    assertEquals(List.of(1L, 2L), pids);
  }

  @Test
  void timestampedDropsRowsWithoutObservation() throws Exception {
    RowSetRef ref =
        store.materialize(
            "process",
            List.of(row("pid", 1L, "first_observed", "2021-01-01T00:00:00Z"), row("pid", 2L)));
    RowSetRef ts = store.timestamped(ref);
    assertEquals("first_observed", store.describe(ts).attributes().get(0));
    assertEquals(1, store.describe(ts).rowCount());

    RowSetRef untimed = store.materialize("process", List.of(row("pid", 1L)));
    assertThrows(SemanticException.class, () -> store.timestamped(untimed));
  }

  @Test
  void groupCountsByDefault() throws Exception {
    RowSetRef ref =
        store.materialize(
            "network-traffic",
            List.of(row("dst_port", 443L), row("dst_port", 80L), row("dst_port", 443L)));
    RowSetRef g = store.aggregate(ref, List.of(new AttributeKey("dst_port")), List.of());
    assertEquals(
        List.of(row("dst_port", 80L, "count", 1L), row("dst_port", 443L, "count", 2L)),
        store.rows(g));
  }

  @Test
  void groupAggregates() throws Exception {
    RowSetRef ref =
        store.materialize(
            "network-traffic",
            List.of(
                row("dst_port", 443L, "bytes", 10L, "src", "a"),
                row("dst_port", 443L, "bytes", 30L, "src", "a"),
                row("dst_port", 443L, "bytes", 5L, "src", "b")));
    RowSetRef g =
        store.aggregate(
            ref,
            List.of(new AttributeKey("dst_port")),
            List.of(
                new Aggregation(AggFunction.SUM, "bytes", null),
                new Aggregation(AggFunction.AVG, "bytes", "mean"),
                new Aggregation(AggFunction.MAX, "bytes", null),
                new Aggregation(AggFunction.NUNIQUE, "src", null)));
    assertEquals(
        List.of(
            row("dst_port", 443L, "sum_bytes", 45L, "mean", 15.0, "max_bytes", 30L,
                "nunique_src", 2L)),
        store.rows(g));
  }

  @Test
  void fiveMinuteBinsAreAlignedToAbsoluteTime() throws Exception {
    List<Map<String, Object>> rows =
        new ArrayList<>(
            List.of(
                row("ts", "2021-01-01T00:01:00Z"),
                row("ts", "2021-01-01T00:04:59Z"),
                row("ts", "2021-01-01T00:05:00Z"),
                row("ts", "2021-01-01T00:09:30Z"),
                row("ts", "2021-01-01T00:12:00Z")));
    List<GroupKey> key = List.of(new BinKey("ts", 5, TimeUnitName.MINUTE));
    List<Map<String, Object>> expected =
        List.of(
            row("bin_ts", "2021-01-01T00:00:00Z", "count", 2L),
            row("bin_ts", "2021-01-01T00:05:00Z", "count", 2L),
            row("bin_ts", "2021-01-01T00:10:00Z", "count", 1L));
    Random random = new Random(7);
    for (int i = 0; i < 5; i++) {
      Collections.shuffle(rows, random);
      RowSetRef ref = store.materialize("x-event", rows);
      assertEquals(expected, store.rows(store.aggregate(ref, key, List.of())));
    }
  }

  @Test
  void nonPositiveBinIsRejected() throws Exception {
    RowSetRef ref = store.materialize("x-event", List.of(row("n", 1L)));
    assertThrows(
        SemanticException.class,
        () -> store.aggregate(ref, List.of(new BinKey("n", 0, null)), List.of()));
  }

  @Test
  void binWidthMustFitTheTimeRange() throws Exception {
    RowSetRef ref = store.materialize("x-event", List.of(row("ts", "2021-01-01T00:01:00Z")));
    SemanticException e =
        assertThrows(
            SemanticException.class,
            () ->
                store.aggregate(
                    ref,
                    List.of(new BinKey("ts", 4611686018427387904L, TimeUnitName.MINUTE)),
                    List.of()));
    assertTrue(e.getMessage().contains("time range"), e.getMessage());

    long widest = Timespan.MAX_WINDOW_SECONDS / TimeUnitName.DAY.seconds();
    RowSetRef g =
        store.aggregate(ref, List.of(new BinKey("ts", widest, TimeUnitName.DAY)), List.of());
    assertEquals(List.of(row("bin_ts", "1970-01-01T00:00:00Z", "count", 1L)), store.rows(g));
  }

  @Test
  void numericBinOverflowIsRejected() throws Exception {
    RowSetRef ref = store.materialize("x-event", List.of(row("n", Long.MIN_VALUE)));
    assertThrows(
        SemanticException.class,
        () -> store.aggregate(ref, List.of(new BinKey("n", Long.MAX_VALUE, null)), List.of()));
  }

  @Test
  void overflowingSumFallsBackToDouble() throws Exception {
    RowSetRef ref =
        store.materialize("x-event", List.of(row("n", Long.MAX_VALUE), row("n", 1L)));
    RowSetRef g =
        store.aggregate(
            ref, List.of(), List.of(new Aggregation(AggFunction.SUM, "n", null)));
    Object sum = store.rows(g).get(0).get("sum_n");
    assertInstanceOf(Double.class, sum);
    assertEquals((double) Long.MAX_VALUE + 1, (Double) sum, 1.0);
  }

  @Test
  void numericBins() throws Exception {
    RowSetRef ref =
        store.materialize("x-event", List.of(row("n", 3L), row("n", 12L), row("n", 14L)));
    RowSetRef g = store.aggregate(ref, List.of(new BinKey("n", 10, null)), List.of());
    assertEquals(
        List.of(row("bin_n", 0L, "count", 1L), row("bin_n", 10L, "count", 2L)), store.rows(g));
  }

  @Test
  void joinOnDefaultAndExplicitKeys() throws Exception {
    RowSetRef parents = store.materialize("process", List.of(row("id", "p1", "pid", 1L)));
    RowSetRef children =
        store.materialize("process", List.of(row("id", "p9", "pid", 50L, "ppid", 1L)));
    assertEquals(0, store.describe(store.join(parents, children, "id", "id")).rowCount());
    RowSetRef joined = store.join(parents, children, "pid", "ppid");
    assertEquals(List.of(row("id", "p1", "pid", 1L, "ppid", 1L)), store.rows(joined));
  }

  @Test
  void joinKeysOfDisjointTypesAreRejected() throws Exception {
    RowSetRef a = store.materialize("process", List.of(row("k", 1L)));
    RowSetRef b = store.materialize("process", List.of(row("k", "one")));
    assertThrows(SemanticException.class, () -> store.join(a, b, "k", "k"));
  }

  @Test
  void unionRemovesDuplicates() throws Exception {
    RowSetRef a = store.materialize("process", List.of(row("pid", 1L), row("pid", 2L)));
    RowSetRef b = store.materialize("process", List.of(row("pid", 2L, "name", "x")));
    RowSetRef c = store.materialize("process", List.of(row("pid", 1L)));
    RowSetRef u = store.union(List.of(a, b, c));
    assertEquals(List.of("pid", "name"), store.describe(u).attributes());
    assertEquals(3, store.describe(u).rowCount());
  }

  @Test
  void releasedRowSetsAreGone() throws Exception {
    RowSetRef ref = processes();
    store.release(ref);
    assertThrows(SemanticException.class, () -> store.describe(ref));
  }
}
