package com.gentoro.kbgen.graph;

import com.gentoro.kbgen.exception.ValidationException;
import java.util.ArrayList;
import java.util.List;

/**
 * A walk through the graph starting at a focal node: node ids interleaved with the edges that
 * connect them.
 */
public record GraphPath(List<String> nodeIds, List<EdgeStep> steps) {
  public GraphPath {
    nodeIds = List.copyOf(nodeIds);
    steps = List.copyOf(steps);
    if (nodeIds.isEmpty() || nodeIds.size() != steps.size() + 1) {
      throw new ValidationException(
          "A path needs exactly one more node than steps: " + nodeIds + " / " + steps);
    }
  }

  public static GraphPath start(String nodeId) {
    return new GraphPath(List.of(nodeId), List.of());
  }

  public GraphPath then(EdgeStep step) {
    if (!step.from().equals(end())) {
      throw new ValidationException("Step " + step + " does not leave node " + end());
    }
    List<String> ids = new ArrayList<>(nodeIds);
    ids.add(step.to());
    List<EdgeStep> s = new ArrayList<>(steps);
    s.add(step);
    return new GraphPath(ids, s);
  }

  public String start() {
    return nodeIds.get(0);
  }

  public String end() {
    return nodeIds.get(nodeIds.size() - 1);
  }

  public int length() {
    return steps.size();
  }

  /** Node ids and relation labels interleaved, e.g. {@code [A, works_at, B, located_in, C]}. */
  public List<String> sequence() {
    List<String> out = new ArrayList<>();
    out.add(nodeIds.get(0));
    for (int i = 0; i < steps.size(); i++) {
      out.add(steps.get(i).label());
      out.add(nodeIds.get(i + 1));
    }
    return out;
  }

  /** Same as {@link #sequence()} with node names instead of ids. */
  public List<String> describe(KnowledgeGraph graph) {
    List<String> out = new ArrayList<>();
    out.add(graph.node(nodeIds.get(0)).getName());
    for (int i = 0; i < steps.size(); i++) {
      out.add(steps.get(i).label());
      out.add(graph.node(nodeIds.get(i + 1)).getName());
    }
    return out;
  }
}
