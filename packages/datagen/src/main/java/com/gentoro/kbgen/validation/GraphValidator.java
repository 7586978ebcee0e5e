package com.gentoro.kbgen.validation;

import com.gentoro.kbgen.graph.Edge;
import com.gentoro.kbgen.graph.KnowledgeGraph;
import com.gentoro.kbgen.graph.Node;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks a {@link KnowledgeGraph} against every {@link InvariantId}.
 *
 * <p>Validation is exhaustive: all violations are collected, grouped by invariant in declaration
 * order and, within an invariant, in graph order. The validator never mutates the graph.
 */
public class GraphValidator {
  private static final org.slf4j.Logger log =
      com.gentoro.kbgen.logging.LoggingService.getLogger(GraphValidator.class);

  public ValidationResult validate(KnowledgeGraph graph) {
    List<Violation> violations = new ArrayList<>();
    checkEdgeEndpoints(graph, violations);
    checkPersonNames(graph, violations);
    checkEmptyNodes(graph, violations);
    checkNodeIds(graph, violations);
    if (!violations.isEmpty()) {
      log.debug("Graph validation found {} violation(s)", violations.size());
    }
    return ValidationResult.of(violations);
  }

  private void checkEdgeEndpoints(KnowledgeGraph graph, List<Violation> out) {
    for (Edge e : graph.edges()) {
      if (!graph.containsNode(e.source())) {
        out.add(
            new Violation(
                InvariantId.EDGE_ENDPOINT_EXISTS,
                e.toString(),
                "Edge source '%s' does not exist".formatted(e.source())));
      }
      if (!graph.containsNode(e.target())) {
        out.add(
            new Violation(
                InvariantId.EDGE_ENDPOINT_EXISTS,
                e.toString(),
                "Edge target '%s' does not exist".formatted(e.target())));
      }
    }
  }

  private void checkPersonNames(KnowledgeGraph graph, List<Violation> out) {
    Map<String, String> firstByName = new HashMap<>();
    for (Node n : graph.persons()) {
      String first = firstByName.putIfAbsent(n.getName(), n.getId());
      if (first != null) {
        out.add(
            new Violation(
                InvariantId.UNIQUE_PERSON_NAME,
                n.getId(),
                "Person name '%s' is already used by node '%s'".formatted(n.getName(), first)));
      }
    }
  }

  private void checkEmptyNodes(KnowledgeGraph graph, List<Violation> out) {
    Set<String> connected = new HashSet<>();
    for (Edge e : graph.edges()) {
      connected.add(e.source());
      connected.add(e.target());
    }
    for (Node n : graph.nodes()) {
      if (!n.hasNonEmptyAttribute() && !connected.contains(n.getId())) {
        out.add(
            new Violation(
                InvariantId.NO_EMPTY_NODE,
                n.getId(),
                "Node '%s' has neither attributes nor relationships".formatted(n.getName())));
      }
    }
  }

  private void checkNodeIds(KnowledgeGraph graph, List<Violation> out) {
    Set<String> seen = new HashSet<>();
    Set<String> reported = new LinkedHashSet<>();
    for (Node n : graph.nodes()) {
      if (!seen.add(n.getId()) && reported.add(n.getId())) {
        out.add(
            new Violation(
                InvariantId.UNIQUE_NODE_ID,
                n.getId(),
                "Node id '%s' is used by more than one node".formatted(n.getId())));
      }
    }
  }
}
