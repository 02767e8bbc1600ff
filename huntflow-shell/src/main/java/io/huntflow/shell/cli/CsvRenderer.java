package io.huntflow.shell.cli;

import io.huntflow.core.io.CsvCodec;
import io.huntflow.shell.core.OutputWriter;
import java.util.List;
import java.util.Map;

/** Displays rows in the same CSV dialect SAVE writes, so output can be loaded back. */
public final class CsvRenderer {
  private CsvRenderer() {}

  public static void render(
      List<String> columns, List<Map<String, Object>> rows, OutputWriter out) {
    String csv = CsvCodec.write(columns, rows);
    out.println(csv.substring(0, csv.length() - 1));
  }
}
