package io.huntflow.core.interpreter;

import java.util.List;
import java.util.Map;

/** Receives what DISP, INFO and APPLY show to the analyst. */
public interface DisplaySink {

  /**
   * Rows of a DISP.
   *
   * @param shown the rows to show, possibly truncated
   * @param total number of rows before truncation
   */
  void rows(
      String variable,
      String entityType,
      List<String> columns,
      List<Map<String, Object>> shown,
      long total);

  void info(VariableInfo info);

  /** Free text, e.g. analytics output. */
  void text(String text);

  void warning(String message);

  /** Metadata shown by INFO. */
  record VariableInfo(
      String name, String entityType, String provenance, long rowCount, List<String> attributes) {
    public VariableInfo {
      attributes = List.copyOf(attributes);
    }
  }

  /** Discards everything. */
  DisplaySink NONE =
      new DisplaySink() {
        @Override
        public void rows(
            String variable,
            String entityType,
            List<String> columns,
            List<Map<String, Object>> shown,
            long total) {}

        @Override
        public void info(VariableInfo info) {}

        @Override
        public void text(String text) {}

        @Override
        public void warning(String message) {}
      };
}
