package com.gentoro.kbgen.graph;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kbgen.exception.SerializationException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GraphCodecTest {

  @TempDir Path tempDir;

  @Test
  void restoresNodesAttributesAndEdgesExactly() {
    KnowledgeGraph original = SampleGraphs.pangorio();
    original.setAttribute("p1", "vegetarian", true);

    KnowledgeGraph restored = GraphCodec.fromJson(GraphCodec.toJson(original));

    assertEquals(original.nodes(), restored.nodes());
    assertEquals(original.edges(), restored.edges());
    assertEquals(
        List.copyOf(original.node("p1").getAttributes().keySet()),
        List.copyOf(restored.node("p1").getAttributes().keySet()));
  }

  @Test
  void numericAttributesSurviveARoundTripWithTheirType() {
    KnowledgeGraph original = new KnowledgeGraph();
    original.addNode("p", "person", "P", SampleGraphs.attrs("age", 5L, "siblings", 2));
    original.setAttribute("p", "height", 1.5f);

    KnowledgeGraph restored = GraphCodec.fromJson(GraphCodec.toJson(original));

    assertEquals(original.nodes(), restored.nodes());
    assertEquals(5L, restored.node("p").getAttributes().get("age"));
    assertEquals(2L, restored.node("p").getAttributes().get("siblings"));
    assertEquals(1.5d, restored.node("p").getAttributes().get("height"));
  }

  @Test
  void writesAndReadsFiles() {
    KnowledgeGraph original = SampleGraphs.restaurantChain();
    Path file = tempDir.resolve("nested/graph.json");
    GraphCodec.write(original, file);

    KnowledgeGraph restored = GraphCodec.read(file);
    assertEquals(original.nodes(), restored.nodes());
    assertEquals(original.edges(), restored.edges());
    // ordinals continue after the restored ones
    assertEquals(3L, restored.addNode("D", "city", "D", null).getCreatedAt());
  }

  @Test
  void jsonUsesDocumentedFieldNames() {
    String json = GraphCodec.toJson(SampleGraphs.restaurantChain());
    assertTrue(json.contains("\"createdAt\""));
    assertTrue(json.contains("\"located_in\""));
    assertTrue(json.contains("\"population\" : 90000"));
  }

  @Test
  void malformedJsonIsASerializationError() {
    assertThrows(SerializationException.class, () -> GraphCodec.fromJson("{\"nodes\": ["));
  }
}
