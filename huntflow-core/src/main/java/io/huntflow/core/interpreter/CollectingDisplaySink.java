package io.huntflow.core.interpreter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Keeps every display in order, for embedding callers and tests. */
public final class CollectingDisplaySink implements DisplaySink {

  /** One collected display. */
  public sealed interface Display permits RowsDisplay, InfoDisplay, TextDisplay, WarningDisplay {}

  public record RowsDisplay(
      String variable,
      String entityType,
      List<String> columns,
      List<Map<String, Object>> rows,
      long total)
      implements Display {}

  public record InfoDisplay(VariableInfo info) implements Display {}

  public record TextDisplay(String text) implements Display {}

  public record WarningDisplay(String message) implements Display {}

  private final List<Display> displays = new ArrayList<>();

  @Override
  public void rows(
      String variable,
      String entityType,
      List<String> columns,
      List<Map<String, Object>> shown,
      long total) {
    displays.add(
        new RowsDisplay(variable, entityType, List.copyOf(columns), List.copyOf(shown), total));
  }

  @Override
  public void info(VariableInfo info) {
    displays.add(new InfoDisplay(info));
  }

  @Override
  public void text(String text) {
    displays.add(new TextDisplay(text));
  }

  @Override
  public void warning(String message) {
    displays.add(new WarningDisplay(message));
  }

  public List<Display> displays() {
    return Collections.unmodifiableList(displays);
  }

  /** Collected displays of one kind. */
  public <T extends Display> List<T> displays(Class<T> kind) {
    List<T> out = new ArrayList<>();
    for (Display d : displays) if (kind.isInstance(d)) out.add(kind.cast(d));
    return out;
  }

  public void clear() {
    displays.clear();
  }
}
