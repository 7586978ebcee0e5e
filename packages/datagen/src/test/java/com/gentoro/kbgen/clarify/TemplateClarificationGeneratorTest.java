package com.gentoro.kbgen.clarify;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kbgen.graph.KnowledgeGraph;
import com.gentoro.kbgen.graph.Node;
import com.gentoro.kbgen.graph.SampleGraphs;
import com.gentoro.kbgen.render.DocumentSet;
import com.gentoro.kbgen.render.NeighborhoodRenderer;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

class TemplateClarificationGeneratorTest {
  private final TemplateClarificationGenerator generator = new TemplateClarificationGenerator();
  private final KnowledgeGraph graph = SampleGraphs.pangorio().freeze();
  private final DocumentSet documents = new NeighborhoodRenderer().render(graph, "p1");

  private ClarificationSample sample(ClarificationKind kind, long seed) {
    return generator.generate(graph, documents, kind, new Random(seed)).orElseThrow();
  }

  @Test
  void unknownEntityIsNotInTheGraph() {
    for (long seed = 0; seed < 20; seed++) {
      ClarificationSample sample = sample(ClarificationKind.NON_EXISTENT_ENTITY, seed);
      String name = sample.rationale().substring("no node is named ".length());
      assertTrue(graph.nodes().stream().map(Node::getName).noneMatch(name::equals), name);
      assertTrue(sample.question().contains(name), sample.question());
      assertTrue(sample.answer().contains(name), sample.answer());
      assertNull(sample.subjectNodeId());
    }
  }

  @Test
  void missingAttributeIsAbsentFromItsSubject() {
    for (long seed = 0; seed < 20; seed++) {
      ClarificationSample sample = sample(ClarificationKind.NON_EXISTENT_ATTRIBUTE, seed);
      Node subject = graph.node(sample.subjectNodeId());
      assertTrue(documents.nodeIds().contains(subject.getId()));
      assertFalse(subject.getAttributes().containsKey(sample.attribute()), sample.toString());
      assertTrue(sample.question().contains(subject.getName()), sample.question());
    }
  }

  @Test
  void contradictionStatesADifferentValue() {
    for (long seed = 0; seed < 20; seed++) {
      ClarificationSample sample = sample(ClarificationKind.CONTRADICTION, seed);
      Node subject = graph.node(sample.subjectNodeId());
      Object actual = subject.getAttributes().get(sample.attribute());
      assertNotNull(actual, sample.toString());
      assertEquals("memory records " + actual, sample.rationale());
      assertTrue(sample.answer().contains(" is " + actual + ", not "), sample.answer());
    }
  }

  @Test
  void conflictingValuesKeepTheKindOfTheActualOne() {
    Node restaurant = graph.node("e1");
    Random random = new Random(2);
    Object seats =
        TemplateClarificationGenerator.conflictingValue(graph, restaurant, "seats", 60L, random);
    assertInstanceOf(Long.class, seats);
    assertNotEquals(60L, seats);
    assertEquals(
        Boolean.FALSE,
        TemplateClarificationGenerator.conflictingValue(graph, restaurant, "open", true, random));
    // another person's occupation is preferred over a made-up one
    assertEquals(
        "owner",
        TemplateClarificationGenerator.conflictingValue(
            graph, graph.node("p2"), "occupation", "line cook", random));
  }

  @Test
  void sameSeedGivesTheSameSample() {
    for (ClarificationKind kind : ClarificationKind.values()) {
      assertEquals(sample(kind, 9), sample(kind, 9), kind.label());
    }
  }

  @Test
  void nodeWithoutAttributesOffersNoContradiction() {
    KnowledgeGraph bare = new KnowledgeGraph();
    bare.addNode("p", "person", "Solo", Map.of());
    DocumentSet solo = new NeighborhoodRenderer().render(bare, "p");

    assertTrue(
        generator.generate(bare, solo, ClarificationKind.CONTRADICTION, new Random(1)).isEmpty());
    assertTrue(
        generator
            .generate(bare, solo, ClarificationKind.NON_EXISTENT_ATTRIBUTE, new Random(1))
            .isPresent());
  }
}
