package io.huntflow.core.io;

import static org.junit.jupiter.api.Assertions.*;

import io.huntflow.core.error.HuntflowIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExtensionFileIOTest {
  private final ExtensionFileIO io = new ExtensionFileIO();

  @TempDir Path dir;

  @Test
  void formatFollowsExtension() throws Exception {
    assertEquals(ExtensionFileIO.Format.CSV, ExtensionFileIO.formatOf(Path.of("a.CSV")));
    assertEquals(ExtensionFileIO.Format.JSON, ExtensionFileIO.formatOf(Path.of("a.json")));
    HuntflowIOException e =
        assertThrows(HuntflowIOException.class, () -> ExtensionFileIO.formatOf(Path.of("a.txt")));
    assertTrue(e.getMessage().contains(".csv or .json"), e.getMessage());
  }

  @Test
  void readsBundleObjects() throws Exception {
    Path file = dir.resolve("bundle.json");
    Files.writeString(
        file,
        """
        {"type": "bundle", "objects": [
          {"type": "process", "pid": 4, "hashes": {"MD5": "ab"}},
          {"type": "file", "size": 1.5, "tags": ["a", "b"]}
        ]}
        """);
    List<Map<String, Object>> rows = io.load(file);
    assertEquals(2, rows.size());
    assertEquals(4L, rows.get(0).get("pid"));
    assertEquals(Map.of("MD5", "ab"), rows.get(0).get("hashes"));
    assertEquals(1.5, rows.get(1).get("size"));
    assertEquals(List.of("a", "b"), rows.get(1).get("tags"));
  }

  @Test
  void savesJsonInColumnOrder() throws Exception {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("b", 2L);
    row.put("a", null);
    Path file = dir.resolve("nested/out.json");
    io.save(List.of("a", "b"), List.of(row), file);
    String text = Files.readString(file);
    assertTrue(text.indexOf("\"a\": null") < text.indexOf("\"b\": 2"), text);
    assertEquals(row, io.load(file).get(0));
  }

  @Test
  void malformedJsonIsAnIoError() throws Exception {
    Path file = dir.resolve("bad.json");
    Files.writeString(file, "[1, 2]");
    HuntflowIOException e = assertThrows(HuntflowIOException.class, () -> io.load(file));
    assertTrue(e.getMessage().startsWith("Malformed JSON"), e.getMessage());
  }

  @Test
  void missingFileIsAnIoError() {
    assertThrows(HuntflowIOException.class, () -> io.load(dir.resolve("none.csv")));
  }
}
