package io.huntflow.core.connector;

import io.huntflow.core.error.DataSourceException;
import io.huntflow.core.lang.Timespan;
import io.huntflow.core.pattern.Predicate;
import java.util.List;
import java.util.Map;

/**
 * Fetches entities from a telemetry source. Implementations are discovered through {@link
 * java.util.ServiceLoader} and selected by the scheme of the datasource locator.
 */
public interface DatasourceConnector {

  /** Locator scheme served, e.g. {@code bundle} for {@code bundle:/data/hunt.json}. */
  String scheme();

  /** One-line description for listings. */
  default String description() {
    return scheme();
  }

  /**
   * Fetches entities of a type. The result must be deterministic for the same inputs.
   *
   * @param locator full datasource locator including the scheme
   * @param entityType requested entity type
   * @param predicate compiled WHERE pattern, never null
   * @param timespan resolved observation window, or null for any time
   * @throws DataSourceException if the source cannot be reached, read or authenticated against
   */
  FetchResult fetch(
      String locator, String entityType, Predicate predicate, Timespan.Absolute timespan)
      throws DataSourceException;

  /**
   * Rows of a fetch.
   *
   * @param entities matching entities of the requested type
   * @param related other entities observed together with them (e.g. referenced processes and
   *     files), fed to the entity universe for FIND
   */
  record FetchResult(List<Map<String, Object>> entities, List<Map<String, Object>> related) {
    public FetchResult {
      entities = List.copyOf(entities);
      related = List.copyOf(related);
    }

    public static FetchResult of(List<Map<String, Object>> entities) {
      return new FetchResult(entities, List.of());
    }
  }
}
