package io.huntflow.shell.cli;

import java.util.Locale;

/** How DISP rows are printed. */
public enum OutputFormat {
  TABLE,
  CSV,
  JSON;

  /**
   * Parses a format name, case-insensitively.
   *
   * @throws IllegalArgumentException for an unknown name
   */
  public static OutputFormat parse(String name) {
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Unknown output format '" + name + "'; expected table, csv or json");
    }
  }
}
