package io.huntflow.shell.cli;

import io.huntflow.core.interpreter.DisplaySink;
import io.huntflow.shell.core.OutputWriter;
import java.util.List;
import java.util.Map;

/** Prints what huntflows display, rows in the selected {@link OutputFormat}. */
public final class RenderingDisplaySink implements DisplaySink {
  private final OutputWriter out;
  private final boolean quiet;
  private volatile OutputFormat format;

  public RenderingDisplaySink(OutputWriter out, OutputFormat format, boolean quiet) {
    this.out = out;
    this.format = format;
    this.quiet = quiet;
  }

  public OutputFormat format() {
    return format;
  }

  public void setFormat(OutputFormat format) {
    this.format = format;
  }

  @Override
  public void rows(
      String variable,
      String entityType,
      List<String> columns,
      List<Map<String, Object>> shown,
      long total) {
    switch (format) {
      case CSV -> CsvRenderer.render(columns, shown, out);
      case JSON -> JsonRenderer.render(columns, shown, out);
      default -> {
        if (!quiet) {
          out.println(variable + (entityType != null ? " (" + entityType + ")" : "") + ":");
        }
        TableRenderer.render(columns, shown, out);
      }
    }
    // footer on stderr keeps csv and json output machine-readable
    if (!quiet && shown.size() < total) {
      out.error("(showing " + shown.size() + " of " + total + " rows)");
    } else if (!quiet && format == OutputFormat.TABLE) {
      out.println("(" + total + (total == 1 ? " row)" : " rows)"));
    }
  }

  @Override
  public void info(VariableInfo info) {
    out.println("Variable:   " + info.name());
    out.println("Type:       " + (info.entityType() != null ? info.entityType() : "(none)"));
    out.println("Created by: " + info.provenance());
    out.println("Rows:       " + info.rowCount());
    out.println("Attributes: " + String.join(", ", info.attributes()));
  }

  @Override
  public void text(String text) {
    out.println(text);
  }

  @Override
  public void warning(String message) {
    out.warning(message);
  }
}
