package io.huntflow.core.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import io.huntflow.core.error.HuntflowIOException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runtime settings of the interpreter.
 *
 * <p>Resolved from (later wins): built-in defaults, the JSON config file ({@code
 * ~/.huntflow/config.json}, or the path in system property {@code huntflow.config} / environment
 * variable {@code HUNTFLOW_CONFIG}), system properties {@code huntflow.*}, environment variables
 * {@code HUNTFLOW_*}.
 *
 * <pre>
 * {
 *   "datasources": { "ds1": "bundle:/data/hunt1.json" },
 *   "defaultDatasource": "ds1",
 *   "analytics": { "tag": "builtin://tag" },
 *   "getTimeoutSeconds": 60,
 *   "applyTimeoutSeconds": 300,
 *   "displayLimit": 100
 * }
 * </pre>
 *
 * @param datasources datasource name to locator
 * @param defaultDatasource datasource GET uses when no FROM is given and none was used before
 * @param analytics analytics name to locator
 * @param getTimeout deadline of one connector fetch
 * @param applyTimeout deadline of one analytics run
 * @param displayLimit rows shown per DISP before truncation, 0 for all
 */
public record HuntflowConfig(
    Map<String, String> datasources,
    String defaultDatasource,
    Map<String, String> analytics,
    Duration getTimeout,
    Duration applyTimeout,
    int displayLimit) {
  private static final Logger LOG = LoggerFactory.getLogger(HuntflowConfig.class);

  private static final String HUNTFLOW_DIR = ".huntflow";
  private static final String CONFIG_JSON = "config.json";
  private static final String CONFIG_PROPERTY = "huntflow.config";
  private static final String CONFIG_ENV = "HUNTFLOW_CONFIG";

  public HuntflowConfig {
    datasources = Collections.unmodifiableMap(new LinkedHashMap<>(datasources));
    analytics = Collections.unmodifiableMap(new LinkedHashMap<>(analytics));
  }

  public static HuntflowConfig defaults() {
    return new HuntflowConfig(
        Map.of(), null, Map.of(), Duration.ofSeconds(60), Duration.ofSeconds(300), 100);
  }

  /** Loads the configuration from the standard locations. */
  public static HuntflowConfig load() throws HuntflowIOException {
    return load(null, System.getProperties(), System.getenv());
  }

  /**
   * Loads the configuration.
   *
   * @param file explicit config file, or null to use the standard location if it exists
   * @param sysProps system properties to apply
   * @param env environment variables to apply
   * @throws HuntflowIOException if the config file cannot be read or parsed
   */
  public static HuntflowConfig load(Path file, Properties sysProps, Map<String, String> env)
      throws HuntflowIOException {
    Path path = file != null ? file : resolveConfigFile(sysProps, env);
    HuntflowConfig config = defaults();
    if (path != null && Files.isRegularFile(path)) {
      config = config.merge(readFile(path));
      LOG.debug("loaded configuration from {}", path);
    } else if (file != null) {
      throw new HuntflowIOException("Config file not found: " + file);
    }
    return config.applyProperties(sysProps).applyEnvironment(env);
  }

  private static Path resolveConfigFile(Properties sysProps, Map<String, String> env) {
    String sysProp = sysProps.getProperty(CONFIG_PROPERTY);
    if (sysProp != null && !sysProp.isBlank()) {
      return Paths.get(sysProp);
    }
    String envVar = env.get(CONFIG_ENV);
    if (envVar != null && !envVar.isBlank()) {
      return Paths.get(envVar);
    }
    String userHome = sysProps.getProperty("user.home");
    return userHome == null ? null : Paths.get(userHome, HUNTFLOW_DIR, CONFIG_JSON);
  }

  /** Shape of the JSON file; absent fields stay null. */
  private static final class FileModel {
    Map<String, String> datasources;
    String defaultDatasource;
    Map<String, String> analytics;
    Long getTimeoutSeconds;
    Long applyTimeoutSeconds;
    Integer displayLimit;
  }

  private static FileModel readFile(Path path) throws HuntflowIOException {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      FileModel model = new Gson().fromJson(reader, FileModel.class);
      return model != null ? model : new FileModel();
    } catch (IOException e) {
      throw new HuntflowIOException("Cannot read config file " + path + ": " + e.getMessage(), e);
    } catch (JsonParseException e) {
      throw new HuntflowIOException("Malformed config file " + path + ": " + e.getMessage(), e);
    }
  }

  private HuntflowConfig merge(FileModel m) {
    Map<String, String> ds = new LinkedHashMap<>(datasources);
    if (m.datasources != null) ds.putAll(m.datasources);
    Map<String, String> an = new LinkedHashMap<>(analytics);
    if (m.analytics != null) an.putAll(m.analytics);
    return new HuntflowConfig(
        ds,
        m.defaultDatasource != null ? m.defaultDatasource : defaultDatasource,
        an,
        m.getTimeoutSeconds != null ? Duration.ofSeconds(m.getTimeoutSeconds) : getTimeout,
        m.applyTimeoutSeconds != null ? Duration.ofSeconds(m.applyTimeoutSeconds) : applyTimeout,
        m.displayLimit != null ? m.displayLimit : displayLimit);
  }

  /**
   * {@code huntflow.defaultDatasource}, {@code huntflow.getTimeoutSeconds}, {@code
   * huntflow.applyTimeoutSeconds}, {@code huntflow.displayLimit}, {@code
   * huntflow.datasource.NAME} and {@code huntflow.analytics.NAME}.
   */
  HuntflowConfig applyProperties(Properties props) {
    Map<String, String> values = new LinkedHashMap<>();
    for (String name : props.stringPropertyNames()) {
      if (name.startsWith("huntflow.")) values.put(name.substring(9), props.getProperty(name));
    }
    return apply(values);
  }

  /**
   * {@code HUNTFLOW_DEFAULT_DATASOURCE}, {@code HUNTFLOW_GET_TIMEOUT_SECONDS}, {@code
   * HUNTFLOW_APPLY_TIMEOUT_SECONDS}, {@code HUNTFLOW_DISPLAY_LIMIT}, {@code
   * HUNTFLOW_DATASOURCE_NAME} and {@code HUNTFLOW_ANALYTICS_NAME}; names are lower-cased.
   */
  HuntflowConfig applyEnvironment(Map<String, String> env) {
    Map<String, String> values = new LinkedHashMap<>();
    for (Map.Entry<String, String> e : env.entrySet()) {
      String key = e.getKey();
      if (!key.startsWith("HUNTFLOW_") || key.equals(CONFIG_ENV)) continue;
      String rest = key.substring(9);
      if (rest.startsWith("DATASOURCE_")) {
        values.put("datasource." + rest.substring(11).toLowerCase(Locale.ROOT), e.getValue());
      } else if (rest.startsWith("ANALYTICS_")) {
        values.put("analytics." + rest.substring(10).toLowerCase(Locale.ROOT), e.getValue());
      } else {
        values.put(camelCase(rest), e.getValue());
      }
    }
    return apply(values);
  }

  private static String camelCase(String upperSnake) {
    StringBuilder sb = new StringBuilder();
    boolean upper = false;
    for (char c : upperSnake.toLowerCase(Locale.ROOT).toCharArray()) {
      if (c == '_') {
        upper = true;
      } else {
        sb.append(upper ? Character.toUpperCase(c) : c);
        upper = false;
      }
    }
    return sb.toString();
  }

  private HuntflowConfig apply(Map<String, String> values) {
    Map<String, String> ds = new LinkedHashMap<>(datasources);
    Map<String, String> an = new LinkedHashMap<>(analytics);
    String defaultDs = defaultDatasource;
    Duration get = getTimeout;
    Duration apply = applyTimeout;
    int limit = displayLimit;
    for (Map.Entry<String, String> e : values.entrySet()) {
      String key = e.getKey();
      String value = e.getValue().trim();
      try {
        if (key.startsWith("datasource.")) {
          ds.put(key.substring(11), value);
        } else if (key.startsWith("analytics.")) {
          an.put(key.substring(10), value);
        } else if (key.equals("defaultDatasource")) {
          defaultDs = value;
        } else if (key.equals("getTimeoutSeconds")) {
          get = Duration.ofSeconds(Long.parseLong(value));
        } else if (key.equals("applyTimeoutSeconds")) {
          apply = Duration.ofSeconds(Long.parseLong(value));
        } else if (key.equals("displayLimit")) {
          limit = Integer.parseInt(value);
        }
      } catch (NumberFormatException ex) {
        LOG.warn("Ignoring setting {}: '{}' is not a number", key, value);
      }
    }
    return new HuntflowConfig(ds, defaultDs, an, get, apply, limit);
  }
}
