package io.huntflow.core.analytics;

import io.huntflow.core.error.AnalyticsException;
import java.util.List;
import java.util.Map;

/**
 * Runs an analytics over variables for APPLY. Implementations are discovered through {@link
 * java.util.ServiceLoader} and selected by the scheme of the analytics locator.
 */
public interface AnalyticsRunner {

  /** Locator scheme served, e.g. {@code builtin} for {@code builtin://tag}. */
  String scheme();

  /**
   * Runs the analytics synchronously. The caller bounds the call with a timeout and interrupts
   * the calling thread when it expires.
   *
   * @param locator full analytics locator including the scheme
   * @param inputs the APPLY variables in source order
   * @param args {@code WITH} arguments
   * @throws AnalyticsException if the analytics fails
   */
  AnalyticsResult invoke(String locator, List<AnalyticsInput> inputs, Map<String, String> args)
      throws AnalyticsException;

  /** Rows of one input variable. */
  record AnalyticsInput(
      String variable, String entityType, List<String> columns, List<Map<String, Object>> rows) {
    public AnalyticsInput {
      columns = List.copyOf(columns);
      rows = List.copyOf(rows);
    }
  }

  /**
   * What an analytics hands back.
   *
   * @param outputs replacement rows per input variable name; variables not listed stay unchanged
   * @param display text to show the analyst, or null
   * @param warnings non-fatal problems, shown and logged
   */
  record AnalyticsResult(
      Map<String, List<Map<String, Object>>> outputs, String display, List<String> warnings) {
    public AnalyticsResult {
      outputs = Map.copyOf(outputs);
      warnings = List.copyOf(warnings);
    }
  }
}
