package io.huntflow.shell.cli;

import static org.junit.jupiter.api.Assertions.*;

import io.huntflow.core.interpreter.DisplaySink.VariableInfo;
import io.huntflow.shell.core.BufferedOutput;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RenderingDisplaySinkTest {
  private final BufferedOutput out = new BufferedOutput();

  private static final List<String> COLUMNS = List.of("name", "pid", "refs");

  private static List<Map<String, Object>> rows() {
    Map<String, Object> a = new LinkedHashMap<>();
    a.put("name", "cmd.exe");
    a.put("pid", 4L);
    a.put("refs", List.of("f1", "f2"));
    Map<String, Object> b = new LinkedHashMap<>();
    b.put("name", "a, \"quoted\" name");
    b.put("pid", null);
    b.put("refs", null);
    return List.of(a, b);
  }

  @Test
  void tablePrintsTitleBoxAndCount() {
    new RenderingDisplaySink(out, OutputFormat.TABLE, false)
        .rows("procs", "process", COLUMNS, rows(), 2);
    String[] lines = out.out().split("\n");
    assertEquals("procs (process):", lines[0]);
    assertEquals("| name             | pid | refs     |", lines[1]);
    assertEquals("+------------------+-----+----------+", lines[2]);
    assertEquals("| cmd.exe          | 4   | [f1, f2] |", lines[3]);
    assertEquals("(2 rows)", lines[5]);
    assertEquals("", out.err());
  }

  @Test
  void truncationFooterGoesToErrors() {
    new RenderingDisplaySink(out, OutputFormat.CSV, false)
        .rows("procs", "process", COLUMNS, rows().subList(0, 1), 2);
    assertEquals("name,pid,refs\ncmd.exe,4,f1 | f2\n", out.out());
    assertEquals("(showing 1 of 2 rows)\n", out.err());
  }

  @Test
  void csvQuotesCells() {
    new RenderingDisplaySink(out, OutputFormat.CSV, true)
        .rows("procs", "process", COLUMNS, rows(), 2);
    assertTrue(out.out().endsWith("\"a, \"\"quoted\"\" name\",,\n"), out.out());
  }

  @Test
  void jsonKeepsColumnOrderAndNulls() {
    RenderingDisplaySink sink = new RenderingDisplaySink(out, OutputFormat.TABLE, true);
    sink.setFormat(OutputFormat.JSON);
    sink.rows("procs", "process", List.of("pid", "name"), rows().subList(1, 2), 1);
    String json = out.out();
    assertTrue(json.startsWith("["), json);
    assertTrue(json.indexOf("\"pid\": null") < json.indexOf("\"name\""), json);
  }

  @Test
  void quietTableHasNoTitle() {
    new RenderingDisplaySink(out, OutputFormat.TABLE, true)
        .rows("procs", "process", COLUMNS, List.of(), 0);
    assertEquals("(no rows)\n", out.out());
  }

  @Test
  void infoAndWarnings() {
    RenderingDisplaySink sink = new RenderingDisplaySink(out, OutputFormat.TABLE, false);
    sink.info(new VariableInfo("procs", "process", "GET", 3, List.of("name", "pid")));
    sink.warning("sample kept all rows");
    assertTrue(out.out().contains("Rows:       3"), out.out());
    assertTrue(out.out().contains("Attributes: name, pid"), out.out());
    assertEquals("Warning: sample kept all rows\n", out.err());
  }

  @Test
  void longCellsAreCut() {
    assertEquals(40, TableRenderer.MAX_CELL);
    Map<String, Object> row = Map.of("cmd", "x".repeat(60));
    new RenderingDisplaySink(out, OutputFormat.TABLE, true)
        .rows("v", null, List.of("cmd"), List.of(row), 1);
    String line = out.out().split("\n")[2];
    assertEquals("| " + "x".repeat(39) + "… |", line);
  }

  @Test
  void unknownFormatName() {
    assertEquals(OutputFormat.CSV, OutputFormat.parse(" Csv "));
    assertThrows(IllegalArgumentException.class, () -> OutputFormat.parse("xml"));
  }
}
