package io.huntflow.core.analytics;

import io.huntflow.core.config.HuntflowConfig;
import io.huntflow.core.error.AnalyticsException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Resolves analytics names and locators to runners; names come from the configuration. */
public final class AnalyticsRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(AnalyticsRegistry.class);

  private static final Pattern SCHEME = Pattern.compile("([A-Za-z][A-Za-z0-9+.\\-]*):.*");

  /** A runner paired with the locator it was resolved for. */
  public record Resolved(String locator, AnalyticsRunner runner) {}

  private final Map<String, AnalyticsRunner> runners = new LinkedHashMap<>();
  private final Map<String, String> analytics;

  public AnalyticsRegistry(HuntflowConfig config, Collection<? extends AnalyticsRunner> list) {
    this.analytics = config.analytics();
    for (AnalyticsRunner r : list) {
      runners.put(r.scheme().toLowerCase(Locale.ROOT), r);
    }
  }

  /** Registry of the runners found on the class path. */
  public static AnalyticsRegistry discover(HuntflowConfig config) {
    ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
    if (classLoader == null) {
      classLoader = AnalyticsRegistry.class.getClassLoader();
    }
    List<AnalyticsRunner> found = new ArrayList<>();
    for (AnalyticsRunner r : ServiceLoader.load(AnalyticsRunner.class, classLoader)) {
      found.add(r);
    }
    LOG.debug(
        "discovered analytics runners: {}", found.stream().map(AnalyticsRunner::scheme).toList());
    return new AnalyticsRegistry(config, found);
  }

  /**
   * Resolves an analytics name or locator.
   *
   * @throws AnalyticsException if neither a configured name nor a served locator
   */
  public Resolved resolve(String analyticsRef) throws AnalyticsException {
    String locator = analytics.getOrDefault(analyticsRef, analyticsRef);
    Matcher m = SCHEME.matcher(locator);
    if (m.matches()) {
      AnalyticsRunner r = runners.get(m.group(1).toLowerCase(Locale.ROOT));
      if (r != null) return new Resolved(locator, r);
    }
    throw new AnalyticsException(
        "Unknown analytics '" + analyticsRef + "'; locator schemes: "
            + String.join(", ", runners.keySet()));
  }

  public Collection<AnalyticsRunner> listAll() {
    return Collections.unmodifiableCollection(runners.values());
  }
}
