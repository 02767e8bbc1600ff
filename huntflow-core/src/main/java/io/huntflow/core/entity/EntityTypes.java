package io.huntflow.core.entity;

import java.util.List;
import java.util.Map;
import java.util.Set;

/** Catalog of known entity types and their identifying attributes. */
public final class EntityTypes {
  private EntityTypes() {}

  /** Attribute holding the entity identifier in every row. */
  public static final String ID = "id";

  /** Attribute holding the entity type when a file or literal carries it per row. */
  public static final String TYPE = "type";

  public static final String FIRST_OBSERVED = "first_observed";
  public static final String LAST_OBSERVED = "last_observed";

  // first available attribute identifies the entity
  private static final Map<String, List<String>> IDENTITY_ATTRIBUTES =
      Map.ofEntries(
          Map.entry("directory", List.of("path")),
          Map.entry("domain-name", List.of("value")),
          Map.entry("email-addr", List.of("value")),
          Map.entry("file", List.of("name")),
          Map.entry("ipv4-addr", List.of("value")),
          Map.entry("ipv6-addr", List.of("value")),
          Map.entry("mac-addr", List.of("value")),
          Map.entry("mutex", List.of("name")),
          Map.entry("process", List.of("pid", "name")),
          Map.entry("software", List.of("name")),
          Map.entry("url", List.of("value")),
          Map.entry("user-account", List.of("user_id")),
          Map.entry("windows-registry-key", List.of("key")));

  private static final Set<String> OTHER_TYPES =
      Set.of(
          "artifact",
          "autonomous-system",
          "email-message",
          "network-traffic",
          "x509-certificate",
          "x-oca-event",
          "x-oca-asset",
          "observed-data");

  /** Whether the type is part of the built-in catalog. Custom {@code x-} types are accepted too. */
  public static boolean isKnown(String type) {
    if (type == null) return false;
    return IDENTITY_ATTRIBUTES.containsKey(type)
        || OTHER_TYPES.contains(type)
        || type.startsWith("x-");
  }

  /** Candidate identity attributes for a type, most specific first; empty if none. */
  public static List<String> identityAttributes(String type) {
    return IDENTITY_ATTRIBUTES.getOrDefault(type, List.of());
  }

  /**
   * Attribute receiving a raw scalar in {@code NEW type ["a", "b"]}: "name" for processes, else
   * the last identity candidate, else "value".
   */
  public static String scalarAttribute(String type) {
    List<String> candidates = identityAttributes(type);
    return candidates.isEmpty() ? "value" : candidates.get(candidates.size() - 1);
  }
}
