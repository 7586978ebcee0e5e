package com.gentoro.kbgen.graph;

/** One traversal of an {@link Edge}, in either direction. */
public record EdgeStep(Edge edge, Direction direction) {

  public static EdgeStep leaving(String nodeId, Edge edge) {
    Direction direction =
        edge.source().equals(nodeId) ? Direction.OUTGOING : Direction.INCOMING;
    return new EdgeStep(edge, direction);
  }

  public String from() {
    return direction == Direction.OUTGOING ? edge.source() : edge.target();
  }

  public String to() {
    return direction == Direction.OUTGOING ? edge.target() : edge.source();
  }

  public String label() {
    return edge.label();
  }
}
