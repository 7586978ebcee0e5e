package com.gentoro.kbgen.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Graph node representing a person or another entity of the world.
 *
 * <p>Nodes are immutable values. The owning {@link KnowledgeGraph} swaps the instance when an
 * attribute changes, so a node handed out earlier never changes under the reader. Integral
 * attribute values are held as {@link Long} and floating point ones as {@link Double}, which is
 * also what a JSON round trip yields.
 */
public final class Node {
  /** Type tag of person nodes; comparison is case-insensitive. */
  public static final String PERSON = "person";

  private final String id;
  private final String type;
  private final String name;
  private final Map<String, Object> attributes;
  private final long createdAt;

  public Node(String id, String type, String name, Map<String, ?> attributes, long createdAt) {
    this.id = Objects.requireNonNull(id, "id");
    this.type = Objects.requireNonNull(type, "type");
    this.name = Objects.requireNonNull(name, "name");
    Map<String, Object> copy = new LinkedHashMap<>();
    if (attributes != null) attributes.forEach((k, v) -> copy.put(k, normalize(v)));
    this.attributes = Collections.unmodifiableMap(copy);
    this.createdAt = createdAt;
  }

  public String getId() {
    return id;
  }

  public String getType() {
    return type;
  }

  public String getName() {
    return name;
  }

  /** Attributes in insertion order. */
  public Map<String, Object> getAttributes() {
    return attributes;
  }

  public long getCreatedAt() {
    return createdAt;
  }

  public boolean isPerson() {
    return PERSON.equalsIgnoreCase(type);
  }

  /** True if at least one attribute carries a non-null, non-blank value. */
  public boolean hasNonEmptyAttribute() {
    return attributes.values().stream().anyMatch(Node::isNonEmpty);
  }

  static boolean isNonEmpty(Object value) {
    if (value == null) return false;
    return !(value instanceof String s) || !s.isBlank();
  }

  static Object normalize(Object value) {
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof Float f) return f.doubleValue();
    return value;
  }

  Node withAttribute(String key, Object value) {
    Map<String, Object> copy = new LinkedHashMap<>(attributes);
    copy.put(key, value);
    return new Node(id, type, name, copy, createdAt);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Node other)) return false;
    return createdAt == other.createdAt
        && id.equals(other.id)
        && type.equals(other.type)
        && name.equals(other.name)
        && attributes.equals(other.attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, type, name, attributes, createdAt);
  }

  @Override
  public String toString() {
    return "Node{" + id + ", " + type + ", '" + name + "'}";
  }
}
