package com.gentoro.kbgen.graph;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kbgen.exception.NotFoundException;
import com.gentoro.kbgen.exception.StateException;
import com.gentoro.kbgen.exception.ValidationException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class KnowledgeGraphTest {

  @Test
  @DisplayName("Nodes get increasing createdAt ordinals in insertion order")
  void ordinalsFollowInsertion() {
    KnowledgeGraph g = SampleGraphs.restaurantChain();
    assertEquals(List.of(0L, 1L, 2L), g.nodes().stream().map(Node::getCreatedAt).toList());
    assertEquals(1, g.persons().size());
    assertEquals("A", g.persons().get(0).getId());
  }

  @Test
  void rejectsSelfLoopsAndDuplicateEdges() {
    KnowledgeGraph g = SampleGraphs.restaurantChain();
    assertThrows(ValidationException.class, () -> g.addEdge("A", "knows", "A"));
    assertThrows(ValidationException.class, () -> g.addEdge("A", "works_at", "B"));
    // same endpoints with another label is a different edge
    g.addEdge("A", "owns", "B");
    assertEquals(3, g.edgeCount());
  }

  @Test
  void unknownNodeLookupThrows() {
    KnowledgeGraph g = SampleGraphs.restaurantChain();
    assertThrows(NotFoundException.class, () -> g.node("Z"));
    assertTrue(g.findNode("Z").isEmpty());
  }

  @Test
  @DisplayName("Incident edges are returned in insertion order for both directions")
  void incidentEdges() {
    KnowledgeGraph g = SampleGraphs.restaurantChain();
    assertEquals(
        List.of(new Edge("A", "works_at", "B"), new Edge("B", "located_in", "C")),
        g.incident("B"));
    assertEquals(List.of(new Edge("B", "located_in", "C")), g.outgoing("B"));
    assertEquals(List.of(new Edge("A", "works_at", "B")), g.incoming("B"));
    assertEquals(List.of("A", "C"), g.neighbors("B"));
  }

  @Test
  void neighborsSkipDanglingEndpoints() {
    KnowledgeGraph g = SampleGraphs.restaurantChain();
    g.addEdge("A", "visited", "ghost");
    assertEquals(List.of("B"), g.neighbors("A"));
  }

  @Test
  void distancesAreUndirectedAndBounded() {
    KnowledgeGraph g = SampleGraphs.restaurantChain();
    assertEquals(Map.of("C", 0, "B", 1, "A", 2), g.distancesFrom("C", 2));
    assertEquals(Map.of("C", 0, "B", 1), g.distancesFrom("C", 1));
    assertThrows(ValidationException.class, () -> g.distancesFrom("C", -1));
  }

  @Test
  void shortestPathFollowsEdgesInEitherDirection() {
    KnowledgeGraph g = SampleGraphs.restaurantChain();
    GraphPath path = g.shortestPath("C", "A").orElseThrow();
    assertEquals(List.of("C", "located_in", "B", "works_at", "A"), path.sequence());
    assertEquals(Direction.INCOMING, path.steps().get(0).direction());
    assertEquals(2, path.length());

    g.addNode("D", "city", "D", Map.of("population", 1));
    assertTrue(g.shortestPath("A", "D").isEmpty());
    assertEquals(0, g.shortestPath("A", "A").orElseThrow().length());
  }

  @Test
  void setAttributeKeepsPosition() {
    KnowledgeGraph g = new KnowledgeGraph();
    g.addNode("p", "person", "P", SampleGraphs.attrs("age", 1, "city", "Rome"));
    Node before = g.node("p");
    g.setAttribute("p", "age", 2);
    assertEquals(List.of("age", "city"), List.copyOf(g.node("p").getAttributes().keySet()));
    assertEquals(2L, g.node("p").getAttributes().get("age"));
    // handed-out nodes are values and do not change
    assertEquals(1L, before.getAttributes().get("age"));
  }

  @Test
  @DisplayName("Replacing an edge target keeps the edge's position")
  void replaceEdgeTarget() {
    KnowledgeGraph g = SampleGraphs.restaurantChain();
    g.addNode("D", "city", "D", Map.of());
    Edge replaced = g.replaceEdgeTarget(new Edge("B", "located_in", "C"), "D");

    assertEquals(new Edge("B", "located_in", "D"), replaced);
    assertEquals(replaced, g.edges().get(1));
    assertTrue(g.incident("C").isEmpty());
    assertEquals(List.of(replaced), g.incident("D"));
    assertThrows(
        NotFoundException.class,
        () -> g.replaceEdgeTarget(new Edge("B", "located_in", "C"), "D"));
    assertThrows(ValidationException.class, () -> g.replaceEdgeTarget(replaced, "B"));
  }

  @Test
  void frozenGraphRejectsMutationButCopiesDoNot() {
    KnowledgeGraph g = SampleGraphs.restaurantChain().freeze();
    assertTrue(g.isFrozen());
    assertThrows(StateException.class, () -> g.addNode("D", "city", "D", Map.of()));
    assertThrows(StateException.class, () -> g.addEdge("A", "knows", "C"));
    assertThrows(StateException.class, () -> g.setAttribute("A", "age", 1));

    KnowledgeGraph copy = g.copy();
    assertFalse(copy.isFrozen());
    Node added = copy.addNode("D", "city", "D", Map.of());
    assertEquals(3L, added.getCreatedAt());
    copy.setAttribute("A", "age", 99);

    assertEquals(3, g.nodeCount());
    assertEquals(34L, g.node("A").getAttributes().get("age"));
    assertEquals(g.edges(), copy.edges());
  }
}
