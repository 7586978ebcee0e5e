package com.gentoro.kbgen.update;

import com.gentoro.kbgen.graph.Edge;

/**
 * A fact the update simulator may change: an attribute of {@code nodeId}, or the target of
 * {@code edge}.
 */
public record MutableFact(
    UpdateKind kind, String nodeId, String attribute, Object currentValue, Edge edge) {

  public static MutableFact attribute(String nodeId, String attribute, Object currentValue) {
    return new MutableFact(UpdateKind.ATTRIBUTE, nodeId, attribute, currentValue, null);
  }

  public static MutableFact relationship(Edge edge) {
    return new MutableFact(UpdateKind.RELATIONSHIP, edge.source(), null, edge.target(), edge);
  }

  /** Attribute key, or the relation label for relationship facts. */
  public String field() {
    return kind == UpdateKind.ATTRIBUTE ? attribute : edge.label();
  }

  @Override
  public String toString() {
    return kind == UpdateKind.ATTRIBUTE ? nodeId + "." + attribute : edge.toString();
  }
}
