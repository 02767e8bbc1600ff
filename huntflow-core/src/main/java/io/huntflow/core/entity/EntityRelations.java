package io.huntflow.core.entity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Relations between entity types traversed by FIND, expressed through reference attributes.
 *
 * <p>Each entry {@code (X, relation, Y)} lists the reference attributes on X that point at Y
 * ({@code sourceRefs}) and the reference attributes on Y that point back at X ({@code
 * targetRefs}). A {@code *_ref} attribute holds one entity id, a {@code *_refs} attribute a list
 * of ids. {@code linked} is the generic relation: every entry between two types, either way.
 */
public final class EntityRelations {
  private EntityRelations() {}

  public static final String LINKED = "linked";

  /** One relation entry. A null relation marks an unnamed link, reachable only through LINKED. */
  public record Relation(
      String source,
      String relation,
      String target,
      List<String> sourceRefs,
      List<String> targetRefs) {}

  /**
   * A resolved traversal: the relation entry plus which side of it the returned entities sit on.
   * {@code returnIsSource} is true when returned entities are X of the entry.
   */
  public record Traversal(Relation relation, boolean returnIsSource) {}

  private static final List<Relation> RELATIONS = new ArrayList<>();

  static {
    // file
    add("file", "contained", "artifact", List.of("content_ref"), List.of());
    add("directory", "contained", "directory", List.of("contains_refs"), List.of("contains_refs"));
    add(
        "directory",
        "contained",
        "file",
        List.of("contains_refs"),
        List.of("parent_directory_ref"));
    // email
    add("user-account", "owned", "email-addr", List.of(), List.of("belongs_to_ref"));
    add("email-addr", "created", "email-message", List.of(), List.of("from_ref", "sender_ref"));
    add(
        "email-addr",
        "accepted",
        "email-message",
        List.of(),
        List.of("to_refs", "cc_refs", "bcc_refs"));
    add("email-message", null, "artifact", List.of("raw_email_ref", "body_raw_ref"), List.of());
    add("email-message", null, "file", List.of("body_raw_ref"), List.of());
    // ip address
    add("autonomous-system", "owned", "ipv4-addr", List.of(), List.of("belongs_to_refs"));
    add("autonomous-system", "owned", "ipv6-addr", List.of(), List.of("belongs_to_refs"));
    // network-traffic
    add("ipv4-addr", "created", "network-traffic", List.of(), List.of("src_ref"));
    add("ipv6-addr", "created", "network-traffic", List.of(), List.of("src_ref"));
    add("mac-addr", "created", "network-traffic", List.of(), List.of("src_ref"));
    add("domain-name", "created", "network-traffic", List.of(), List.of("src_ref"));
    add("artifact", "created", "network-traffic", List.of(), List.of("src_payload_ref"));
    add("mac-addr", null, "ipv4-addr", List.of(), List.of("resolves_to_refs"));
    add("mac-addr", null, "ipv6-addr", List.of(), List.of("resolves_to_refs"));
    add("ipv4-addr", "accepted", "network-traffic", List.of(), List.of("dst_ref"));
    add("ipv6-addr", "accepted", "network-traffic", List.of(), List.of("dst_ref"));
    add("mac-addr", "accepted", "network-traffic", List.of(), List.of("dst_ref"));
    add("domain-name", "accepted", "network-traffic", List.of(), List.of("dst_ref"));
    add("artifact", "accepted", "network-traffic", List.of(), List.of("dst_payload_ref"));
    add(
        "network-traffic",
        "contained",
        "network-traffic",
        List.of("encapsulated_by_ref"),
        List.of("encapsulated_by_ref"));
    // process
    add("process", "created", "network-traffic", List.of("opened_connection_refs"), List.of());
    add("user-account", "owned", "process", List.of(), List.of("creator_user_ref"));
    add("process", "loaded", "file", List.of("binary_ref"), List.of());
    add("process", "created", "process", List.of(), List.of("parent_ref"));
    // service
    add("windows-service-ext", "loaded", "file", List.of("service_dll_refs"), List.of());
    add("windows-service-ext", "loaded", "user-account", List.of("creator_user_ref"), List.of());
  }

  private static void add(
      String source,
      String relation,
      String target,
      List<String> sourceRefs,
      List<String> targetRefs) {
    RELATIONS.add(new Relation(source, relation, target, sourceRefs, targetRefs));
  }

  /** Every named relation plus {@code linked}. */
  public static Set<String> names() {
    Set<String> names = new LinkedHashSet<>();
    for (Relation r : RELATIONS) if (r.relation() != null) names.add(r.relation());
    names.add(LINKED);
    return Collections.unmodifiableSet(names);
  }

  public static boolean isKnown(String relation) {
    return names().contains(relation.toLowerCase(Locale.ROOT));
  }

  /**
   * Resolves {@code FIND returnType relation [BY] inputType}.
   *
   * <p>Without BY the returned entities are the relation's source: {@code (returnType, relation,
   * inputType)}. With BY they are its target: {@code (inputType, relation, returnType)}. LINKED
   * collects every entry between the two types in both directions.
   *
   * @return matching traversals; empty if the types are not related that way
   */
  public static List<Traversal> resolve(
      String returnType, String relation, String inputType, boolean reversed) {
    String rel = relation.toLowerCase(Locale.ROOT);
    Set<Traversal> out = new LinkedHashSet<>();
    for (Relation r : RELATIONS) {
      if (LINKED.equals(rel)) {
        if (r.source().equals(returnType) && r.target().equals(inputType)) {
          out.add(new Traversal(r, true));
        }
        if (r.target().equals(returnType) && r.source().equals(inputType)) {
          out.add(new Traversal(r, false));
        }
      } else if (Objects.equals(r.relation(), rel)) {
        if (!reversed && r.source().equals(returnType) && r.target().equals(inputType)) {
          out.add(new Traversal(r, true));
        } else if (reversed && r.source().equals(inputType) && r.target().equals(returnType)) {
          out.add(new Traversal(r, false));
        }
      }
    }
    return new ArrayList<>(out);
  }
}
