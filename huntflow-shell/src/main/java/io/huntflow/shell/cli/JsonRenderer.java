package io.huntflow.shell.cli;

import io.huntflow.core.io.JsonRows;
import io.huntflow.shell.core.OutputWriter;
import java.util.List;
import java.util.Map;

/** Pretty-printed JSON array of row objects, keys in column order. */
public final class JsonRenderer {
  private JsonRenderer() {}

  public static void render(
      List<String> columns, List<Map<String, Object>> rows, OutputWriter out) {
    out.println(JsonRows.GSON.toJson(JsonRows.toJson(columns, rows)));
  }
}
