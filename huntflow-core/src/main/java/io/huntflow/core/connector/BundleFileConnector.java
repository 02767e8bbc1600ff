package io.huntflow.core.connector;

import io.huntflow.core.entity.EntityTypes;
import io.huntflow.core.error.DataSourceException;
import io.huntflow.core.error.HuntflowIOException;
import io.huntflow.core.error.ValidationException;
import io.huntflow.core.io.ExtensionFileIO;
import io.huntflow.core.lang.Timespan;
import io.huntflow.core.pattern.Predicate;
import io.huntflow.core.pattern.PredicateEvaluator;
import io.huntflow.core.store.Rows;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves entities from JSON bundle files: {@code bundle:/path/file.json} reads one file, {@code
 * bundle:/path/dir} every {@code .json} file of a directory in name order. A bundle is an array of
 * entity objects or an object with an {@code objects} array; every entity carries {@code type}
 * and, to be reachable through references, {@code id}.
 *
 * <p>Objects of a bundle with at least one match are returned as related entities, so FIND can
 * walk from fetched entities to their neighbors.
 */
public final class BundleFileConnector implements DatasourceConnector {
  private static final Logger LOG = LoggerFactory.getLogger(BundleFileConnector.class);

  public static final String SCHEME = "bundle";

  private final ExtensionFileIO files = new ExtensionFileIO();

  @Override
  public String scheme() {
    return SCHEME;
  }

  @Override
  public String description() {
    return "JSON entity bundles on the local file system";
  }

  @Override
  public FetchResult fetch(
      String locator, String entityType, Predicate predicate, Timespan.Absolute timespan)
      throws DataSourceException {
    Path root = pathOf(locator);
    List<Map<String, Object>> entities = new ArrayList<>();
    List<Map<String, Object>> related = new ArrayList<>();
    for (Path file : bundleFiles(root)) {
      List<Map<String, Object>> objects = read(file);
      Map<String, Map<String, Object>> byId = new HashMap<>();
      for (Map<String, Object> o : objects) {
        Object id = o.get(EntityTypes.ID);
        if (id != null) byId.put(id.toString(), o);
      }
      Set<Map<String, Object>> matched = Collections.newSetFromMap(new IdentityHashMap<>());
      for (Map<String, Object> o : objects) {
        if (!entityType.equals(o.get(EntityTypes.TYPE))) continue;
        if (!PredicateEvaluator.test(predicate, o, byId::get)) continue;
        if (timespan != null && !Rows.observedWithin(o, timespan)) continue;
        matched.add(o);
      }
      if (!matched.isEmpty()) {
        for (Map<String, Object> o : objects) {
          if (matched.contains(o)) {
            entities.add(o);
          } else {
            related.add(o);
          }
        }
      }
    }
    LOG.debug(
        "{}: {} {} entities, {} related", locator, entities.size(), entityType, related.size());
    return new FetchResult(entities, related);
  }

  static Path pathOf(String locator) throws DataSourceException {
    String rest = locator.substring(locator.indexOf(':') + 1);
    if (rest.startsWith("//")) rest = rest.substring(2);
    if (rest.isBlank()) throw new DataSourceException("Bundle locator has no path: " + locator);
    return Paths.get(rest);
  }

  private static List<Path> bundleFiles(Path root) throws DataSourceException {
    if (Files.isRegularFile(root)) return List.of(root);
    if (!Files.isDirectory(root)) {
      throw new DataSourceException("Bundle path does not exist: " + root);
    }
    try (Stream<Path> s = Files.list(root)) {
      return s.filter(p -> p.getFileName().toString().endsWith(".json"))
          .filter(Files::isRegularFile)
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new DataSourceException("Cannot list bundle directory " + root + ": " + e, e);
    }
  }

  private List<Map<String, Object>> read(Path file) throws DataSourceException {
    try {
      List<Map<String, Object>> objects = new ArrayList<>();
      for (Map<String, Object> o : files.load(file)) objects.add(Rows.flatten(o));
      return objects;
    } catch (HuntflowIOException | ValidationException e) {
      throw new DataSourceException("Cannot read bundle " + file + ": " + e.getMessage(), e);
    }
  }
}
