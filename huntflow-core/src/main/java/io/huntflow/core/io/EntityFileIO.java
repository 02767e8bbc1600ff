package io.huntflow.core.io;

import io.huntflow.core.error.HuntflowIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** Reads and writes entity rows for LOAD and SAVE; the format follows the file extension. */
public interface EntityFileIO {

  /**
   * Reads every entity of a file.
   *
   * @throws HuntflowIOException if the file is unreadable, malformed or of an unknown format
   */
  List<Map<String, Object>> load(Path path) throws HuntflowIOException;

  /**
   * Writes rows with the given columns, replacing the file.
   *
   * @throws HuntflowIOException if the file cannot be written or the format is unknown
   */
  void save(List<String> columns, List<Map<String, Object>> rows, Path path)
      throws HuntflowIOException;
}
