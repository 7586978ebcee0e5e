package com.gentoro.kbgen.render;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kbgen.exception.LinkResolutionException;
import com.gentoro.kbgen.graph.KnowledgeGraph;
import com.gentoro.kbgen.graph.SampleGraphs;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NeighborhoodRendererTest {

  private final NeighborhoodRenderer renderer = new NeighborhoodRenderer();

  @Test
  @DisplayName("A -works_at-> B -located_in-> C renders three linked documents")
  void rendersChainAtRadiusTwo() {
    DocumentSet docs = renderer.render(SampleGraphs.restaurantChain(), "A");

    assertEquals(List.of("user", "restaurant/b", "city/c"), docs.keys());
    assertEquals(List.of(new DocumentLink("works_at", "restaurant/b")), docs.get("user").links());
    assertEquals(
        List.of(new DocumentLink("located_in", "city/c")), docs.get("restaurant/b").links());
    assertTrue(docs.get("city/c").links().isEmpty());
    assertEquals(List.of("A", "B", "C"), docs.nodeIds());
  }

  @Test
  void markdownLayout() {
    DocumentSet docs = renderer.render(SampleGraphs.restaurantChain(), "A");
    assertEquals(
        "# A\n"
            + "\n## Person Information\n"
            + "- **Age**: 34\n"
            + "\n## Relationships\n"
            + "- **Works At**: [B](restaurant/b)\n",
        docs.get("user").toMarkdown());
    assertEquals(
        "# C\n\n## City Information\n- **Population**: 90000\n", docs.get("city/c").toMarkdown());
  }

  @Test
  void radiusBoundsTheNeighborhood() {
    KnowledgeGraph g = SampleGraphs.restaurantChain();
    DocumentSet docs = renderer.render(g, "A", 1);
    assertEquals(List.of("user", "restaurant/b"), docs.keys());
    // the edge to C is dropped rather than left dangling
    assertTrue(docs.get("restaurant/b").links().isEmpty());
    assertEquals(List.of("user"), renderer.render(g, "A", 0).keys());
  }

  @Test
  @DisplayName("Incoming edges are reachable but rendered only on their source document")
  void incomingEdgesAreTraversed() {
    DocumentSet docs = renderer.render(SampleGraphs.restaurantChain(), "C");
    assertEquals(List.of("user", "person/a", "restaurant/b"), docs.keys());
    assertTrue(docs.get("user").links().isEmpty());
    assertEquals(List.of(new DocumentLink("located_in", "user")), docs.get("restaurant/b").links());
  }

  @Test
  void everyLinkResolvesInsideTheSet() {
    KnowledgeGraph g = SampleGraphs.pangorio();
    for (String focal : List.of("p1", "p2", "p3")) {
      for (int radius = 0; radius <= 3; radius++) {
        DocumentSet docs = renderer.render(g, focal, radius);
        for (Document d : docs.documents().values()) {
          for (DocumentLink link : d.links()) {
            assertTrue(docs.contains(link.targetKey()), d.key() + " -> " + link.targetKey());
          }
        }
      }
    }
  }

  @Test
  void renderingIsIdempotent() {
    KnowledgeGraph g = SampleGraphs.pangorio();
    DocumentSet first = renderer.render(g, "p2");
    DocumentSet second = renderer.render(g, "p2");
    assertEquals(first, second);
    for (String key : first.keys()) {
      assertEquals(first.get(key).toMarkdown(), second.get(key).toMarkdown());
    }
  }

  @Test
  void isolatedFocalNodeRendersAlone() {
    KnowledgeGraph g = new KnowledgeGraph();
    g.addNode("p", "person", "Solo", Map.of("hobby", "chess"));
    DocumentSet docs = renderer.render(g, "p");
    assertEquals(List.of("user"), docs.keys());
    assertEquals("Solo", docs.get("user").title());
  }

  @Test
  void collidingKeysGetNumericSuffixes() {
    KnowledgeGraph g = new KnowledgeGraph();
    g.addNode("p", "person", "Ann", Map.of("age", 30));
    g.addNode("c1", "city", "Springfield", Map.of("state", "IL"));
    g.addNode("c2", "city", "Springfield", Map.of("state", "MO"));
    g.addEdge("p", "lives_in", "c1");
    g.addEdge("p", "born_in", "c2");

    DocumentSet docs = renderer.render(g, "p");
    assertEquals(List.of("user", "city/springfield", "city/springfield_2"), docs.keys());
    assertEquals("c2", docs.get("city/springfield_2").nodeId());
  }

  @Test
  void retainedNodesAreRenderedBeyondTheRadius() {
    KnowledgeGraph g = SampleGraphs.restaurantChain();
    DocumentSet docs = renderer.render(g, "A", 1, List.of("C", "missing"));
    assertEquals(List.of("user", "restaurant/b", "city/c"), docs.keys());
  }

  @Test
  void closureCheckRejectsDanglingLinks() {
    Document doc =
        new Document(
            "user",
            "A",
            "A",
            List.of(new DocumentField(Document.RELATIONSHIPS, "knows", "B", "person/b")));
    DocumentSet set = DocumentSet.of("A", 1, List.of(doc));
    assertThrows(LinkResolutionException.class, set::checkClosure);
  }
}
