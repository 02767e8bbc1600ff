package io.huntflow.core.io;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.huntflow.core.error.HuntflowIOException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EntityFileIO} choosing CSV or JSON by file extension. JSON files hold an array of
 * objects or a bundle object with an {@code objects} array.
 */
public final class ExtensionFileIO implements EntityFileIO {
  private static final Logger LOG = LoggerFactory.getLogger(ExtensionFileIO.class);

  enum Format {
    CSV,
    JSON
  }

  static Format formatOf(Path path) throws HuntflowIOException {
    String name = path.getFileName() == null ? "" : path.getFileName().toString();
    String lower = name.toLowerCase(Locale.ROOT);
    if (lower.endsWith(".csv")) return Format.CSV;
    if (lower.endsWith(".json")) return Format.JSON;
    throw new HuntflowIOException(
        "Unsupported file format for '" + path + "': expected a .csv or .json extension");
  }

  @Override
  public List<Map<String, Object>> load(Path path) throws HuntflowIOException {
    Format format = formatOf(path);
    String text;
    try {
      text = Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new HuntflowIOException("Cannot read " + path + ": " + e, e);
    }
    try {
      List<Map<String, Object>> rows =
          format == Format.CSV ? CsvCodec.read(text) : readJson(text);
      LOG.debug("loaded {} rows from {}", rows.size(), path);
      return rows;
    } catch (IllegalArgumentException | JsonParseException | IllegalStateException e) {
      throw new HuntflowIOException(
          "Malformed " + format + " file " + path + ": " + e.getMessage(), e);
    }
  }

  private static List<Map<String, Object>> readJson(String text) {
    JsonElement root = JsonParser.parseString(text);
    if (root.isJsonArray()) return JsonRows.toRows(root.getAsJsonArray());
    if (root.isJsonObject()) {
      JsonObject o = root.getAsJsonObject();
      if (o.has("objects") && o.get("objects").isJsonArray()) {
        return JsonRows.toRows(o.getAsJsonArray("objects"));
      }
      return List.of(JsonRows.toRow(o));
    }
    throw new IllegalArgumentException("expected a JSON array or object");
  }

  @Override
  public void save(List<String> columns, List<Map<String, Object>> rows, Path path)
      throws HuntflowIOException {
    Format format = formatOf(path);
    String text =
        format == Format.CSV
            ? CsvCodec.write(columns, rows)
            : JsonRows.GSON.toJson(JsonRows.toJson(columns, rows)) + "\n";
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
      Files.writeString(path, text, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new HuntflowIOException("Cannot write " + path + ": " + e, e);
    }
    LOG.debug("saved {} rows to {}", rows.size(), path);
  }
}
