package io.huntflow.core.connector;

import static org.junit.jupiter.api.Assertions.*;

import io.huntflow.core.config.HuntflowConfig;
import io.huntflow.core.error.DataSourceException;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConnectorRegistryTest {
  private static final HuntflowConfig CONFIG =
      new HuntflowConfig(
          Map.of("ds1", "bundle:/data/hunt.json"),
          null,
          Map.of(),
          Duration.ofSeconds(1),
          Duration.ofSeconds(1),
          10);

  @Test
  void discoversBundleConnector() {
    ConnectorRegistry registry = ConnectorRegistry.discover(CONFIG);
    assertTrue(registry.get("BUNDLE").isPresent());
    assertInstanceOf(BundleFileConnector.class, registry.get("bundle").get());
  }

  @Test
  void resolvesNamesAndLocators() throws Exception {
    ConnectorRegistry registry = ConnectorRegistry.discover(CONFIG);
    assertEquals("bundle:/data/hunt.json", registry.resolve("ds1").locator());
    assertEquals("bundle:/elsewhere", registry.resolve("bundle:/elsewhere").locator());
  }

  @Test
  void unknownSourceListsAlternatives() {
    ConnectorRegistry registry = ConnectorRegistry.discover(CONFIG);
    DataSourceException e =
        assertThrows(DataSourceException.class, () -> registry.resolve("stix-shifter://x"));
    assertTrue(e.getMessage().contains("configured: ds1"), e.getMessage());
    assertTrue(e.getMessage().contains("bundle"), e.getMessage());
    assertThrows(DataSourceException.class, () -> registry.resolve("host-1"));
  }
}
