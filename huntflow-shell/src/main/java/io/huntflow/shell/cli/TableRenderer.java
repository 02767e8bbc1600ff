package io.huntflow.shell.cli;

import io.huntflow.shell.core.OutputWriter;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/** Boxed text table of rows; cells are cut at 40 characters. */
public final class TableRenderer {
  static final int MAX_CELL = 40;

  private TableRenderer() {}

  public static void render(
      List<String> columns, List<Map<String, Object>> rows, OutputWriter out) {
    if (rows.isEmpty()) {
      out.println("(no rows)");
      return;
    }
    int[] widths = new int[columns.size()];
    for (int c = 0; c < columns.size(); c++) widths[c] = columns.get(c).length();
    String[][] cells = new String[rows.size()][columns.size()];
    for (int r = 0; r < rows.size(); r++) {
      for (int c = 0; c < columns.size(); c++) {
        String cell = toCell(rows.get(r).get(columns.get(c)));
        cells[r][c] = cell;
        widths[c] = Math.max(widths[c], Math.min(MAX_CELL, cell.length()));
      }
    }
    printLine(columns.toArray(new String[0]), widths, out);
    StringBuilder sep = new StringBuilder();
    for (int w : widths) {
      sep.append("+").append("-".repeat(w + 2));
    }
    sep.append("+");
    out.println(sep.toString());
    for (String[] row : cells) printLine(row, widths, out);
  }

  private static void printLine(String[] cells, int[] widths, OutputWriter out) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < cells.length; i++) {
      String v = truncate(cells[i], widths[i]);
      sb.append("| ").append(pad(v, widths[i])).append(" ");
    }
    sb.append("|");
    out.println(sb.toString());
  }

  static String toCell(Object v) {
    if (v == null) return "";
    if (v instanceof Collection<?> coll) {
      StringBuilder sb = new StringBuilder();
      for (Object item : coll) {
        if (sb.length() > 0) sb.append(", ");
        sb.append(item);
      }
      return "[" + sb + "]";
    }
    return String.valueOf(v).replace('\n', ' ');
  }

  private static String pad(String s, int w) {
    if (s.length() >= w) return s;
    return s + " ".repeat(w - s.length());
  }

  private static String truncate(String s, int w) {
    if (s.length() <= w) return s;
    if (w <= 1) return s.substring(0, w);
    return s.substring(0, w - 1) + "…";
  }
}
