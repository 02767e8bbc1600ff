package io.huntflow.core.io;

import io.huntflow.core.store.RowSorter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RFC 4180 CSV for entity rows. Lists are written as {@code a | b}; on read, empty cells become
 * null and {@code true}/{@code false} and numbers are re-inferred, so value types are not
 * preserved exactly.
 */
public final class CsvCodec {
  private CsvCodec() {}

  /** Header line plus one line per row, each terminated by {@code \n}. */
  public static String write(List<String> columns, List<Map<String, Object>> rows) {
    StringBuilder sb = new StringBuilder();
    sb.append(toCsvLine(columns)).append('\n');
    for (Map<String, Object> row : rows) {
      List<String> values = new ArrayList<>(columns.size());
      for (String c : columns) values.add(toCsvCell(row.get(c)));
      sb.append(toCsvLine(values)).append('\n');
    }
    return sb.toString();
  }

  private static String toCsvLine(List<String> values) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) sb.append(',');
      sb.append(escapeCsv(values.get(i)));
    }
    return sb.toString();
  }

  private static String toCsvCell(Object v) {
    if (v == null) return "";
    if (v instanceof Collection<?> coll) {
      StringBuilder sb = new StringBuilder();
      boolean first = true;
      for (Object item : coll) {
        if (!first) sb.append(" | ");
        first = false;
        sb.append(String.valueOf(item));
      }
      return sb.toString();
    }
    return String.valueOf(v);
  }

  private static String escapeCsv(String s) {
    if (s == null) return "";
    if (s.contains(",") || s.contains("\"") || s.contains("\n") || s.contains("\r")) {
      return '"' + s.replace("\"", "\"\"") + '"';
    }
    return s;
  }

  /**
   * Parses CSV text with a header line.
   *
   * @throws IllegalArgumentException on an unterminated quote or a row wider than the header
   */
  static List<Map<String, Object>> read(String text) {
    List<List<String>> records = parse(text);
    List<Map<String, Object>> rows = new ArrayList<>();
    if (records.isEmpty()) return rows;
    List<String> header = records.get(0);
    for (int i = 1; i < records.size(); i++) {
      List<String> rec = records.get(i);
      if (rec.size() == 1 && rec.get(0).isEmpty()) continue;
      if (rec.size() > header.size()) {
        throw new IllegalArgumentException(
            "record " + i + " has " + rec.size() + " fields, header has " + header.size());
      }
      Map<String, Object> row = new LinkedHashMap<>();
      for (int c = 0; c < header.size(); c++) {
        row.put(header.get(c), c < rec.size() ? infer(rec.get(c)) : null);
      }
      rows.add(row);
    }
    return rows;
  }

  private static List<List<String>> parse(String text) {
    List<List<String>> records = new ArrayList<>();
    List<String> current = new ArrayList<>();
    StringBuilder field = new StringBuilder();
    boolean quoted = false;
    int i = 0;
    int n = text.length();
    if (n > 0 && text.charAt(0) == '\uFEFF') i++;
    while (i < n) {
      char ch = text.charAt(i);
      if (quoted) {
        if (ch == '"') {
          if (i + 1 < n && text.charAt(i + 1) == '"') {
            field.append('"');
            i++;
          } else {
            quoted = false;
          }
        } else {
          field.append(ch);
        }
      } else if (ch == '"') {
        quoted = true;
      } else if (ch == ',') {
        current.add(field.toString());
        field.setLength(0);
      } else if (ch == '\n' || ch == '\r') {
        if (ch == '\r' && i + 1 < n && text.charAt(i + 1) == '\n') i++;
        current.add(field.toString());
        field.setLength(0);
        records.add(current);
        current = new ArrayList<>();
      } else {
        field.append(ch);
      }
      i++;
    }
    if (quoted) throw new IllegalArgumentException("unterminated quoted field");
    if (field.length() > 0 || !current.isEmpty()) {
      current.add(field.toString());
      records.add(current);
    }
    return records;
  }

  private static Object infer(String cell) {
    if (cell.isEmpty()) return null;
    if (cell.equalsIgnoreCase("true")) return Boolean.TRUE;
    if (cell.equalsIgnoreCase("false")) return Boolean.FALSE;
    // leading zeros and '+' mark identifiers such as "007", not numbers
    boolean leadingZero = cell.length() > 1 && cell.startsWith("0") && cell.charAt(1) != '.';
    if (cell.startsWith("+") || leadingZero) return cell;
    Number n = RowSorter.parseNumber(cell);
    return n != null ? n : cell;
  }
}
