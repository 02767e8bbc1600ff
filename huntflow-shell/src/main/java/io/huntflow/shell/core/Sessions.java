package io.huntflow.shell.core;

import io.huntflow.core.analytics.AnalyticsRegistry;
import io.huntflow.core.config.HuntflowConfig;
import io.huntflow.core.connector.ConnectorRegistry;
import io.huntflow.core.interpreter.DisplaySink;
import io.huntflow.core.interpreter.HuntflowInterpreter;
import io.huntflow.core.io.ExtensionFileIO;
import io.huntflow.core.session.HuntflowSession;
import io.huntflow.core.store.InMemoryStore;

/** Wires sessions with the connectors and analytics runners found on the class path. */
public final class Sessions {
  private Sessions() {}

  /** Session manager whose sessions keep their rows in memory and print to {@code display}. */
  public static SessionManager inMemory(HuntflowConfig config, DisplaySink display) {
    ConnectorRegistry connectors = ConnectorRegistry.discover(config);
    AnalyticsRegistry analytics = AnalyticsRegistry.discover(config);
    ExtensionFileIO files = new ExtensionFileIO();
    return new SessionManager(
        id ->
            new HuntflowInterpreter(
                new HuntflowSession(id, new InMemoryStore(id)),
                connectors,
                analytics,
                files,
                config,
                display));
  }
}
