package io.huntflow.core.connector;

import io.huntflow.core.config.HuntflowConfig;
import io.huntflow.core.error.DataSourceException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves datasource names and locators to connectors.
 *
 * <p>A GET source is looked up in this order:
 *
 * <ol>
 *   <li>a datasource name configured in {@link HuntflowConfig#datasources()}
 *   <li>a locator whose scheme a registered connector serves
 * </ol>
 */
public final class ConnectorRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(ConnectorRegistry.class);

  private static final Pattern SCHEME = Pattern.compile("([A-Za-z][A-Za-z0-9+.\\-]*):.*");

  /** A connector paired with the locator it was resolved for. */
  public record Resolved(String locator, DatasourceConnector connector) {}

  private final Map<String, DatasourceConnector> connectors = new LinkedHashMap<>();
  private final Map<String, String> datasources;

  public ConnectorRegistry(HuntflowConfig config, Collection<? extends DatasourceConnector> list) {
    this.datasources = config.datasources();
    for (DatasourceConnector c : list) {
      connectors.put(c.scheme().toLowerCase(Locale.ROOT), c);
    }
  }

  /** Registry of the connectors found on the class path. */
  public static ConnectorRegistry discover(HuntflowConfig config) {
    ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
    if (classLoader == null) {
      classLoader = ConnectorRegistry.class.getClassLoader();
    }
    List<DatasourceConnector> found = new ArrayList<>();
    for (DatasourceConnector c : ServiceLoader.load(DatasourceConnector.class, classLoader)) {
      found.add(c);
    }
    LOG.debug(
        "discovered connectors: {}", found.stream().map(DatasourceConnector::scheme).toList());
    return new ConnectorRegistry(config, found);
  }

  /**
   * Resolves a datasource name or locator.
   *
   * @throws DataSourceException if neither a configured name nor a served locator
   */
  public Resolved resolve(String source) throws DataSourceException {
    String locator = datasources.getOrDefault(source, source);
    Matcher m = SCHEME.matcher(locator);
    if (m.matches()) {
      DatasourceConnector c = connectors.get(m.group(1).toLowerCase(Locale.ROOT));
      if (c != null) return new Resolved(locator, c);
    }
    StringBuilder msg = new StringBuilder("Unknown datasource '").append(source).append('\'');
    if (!datasources.isEmpty()) {
      msg.append("; configured: ").append(String.join(", ", datasources.keySet()));
    }
    msg.append("; locator schemes: ").append(String.join(", ", connectors.keySet()));
    throw new DataSourceException(msg.toString());
  }

  public Optional<DatasourceConnector> get(String scheme) {
    return Optional.ofNullable(connectors.get(scheme.toLowerCase(Locale.ROOT)));
  }

  public Collection<DatasourceConnector> listAll() {
    return Collections.unmodifiableCollection(connectors.values());
  }

  public Map<String, String> datasources() {
    return datasources;
  }
}
