package com.gentoro.kbgen.graph;

import com.gentoro.kbgen.exception.ValidationException;

/**
 * Directed, labeled relationship between two nodes, e.g. {@code (alice, works_at, pangorio)}.
 *
 * <p>Labels are free-form and kept verbatim; they become field names of rendered documents.
 */
public record Edge(String source, String label, String target) {
  public Edge {
    if (source == null || source.isBlank()) {
      throw new ValidationException("Edge source cannot be null or empty");
    }
    if (target == null || target.isBlank()) {
      throw new ValidationException("Edge target cannot be null or empty");
    }
    if (label == null || label.isBlank()) {
      throw new ValidationException("Edge label cannot be null or empty");
    }
    label = label.trim();
  }

  /** The endpoint opposite to {@code nodeId}. */
  public String other(String nodeId) {
    return source.equals(nodeId) ? target : source;
  }

  Edge withTarget(String newTarget) {
    return new Edge(source, label, newTarget);
  }

  @Override
  public String toString() {
    return source + " -" + label + "-> " + target;
  }
}
