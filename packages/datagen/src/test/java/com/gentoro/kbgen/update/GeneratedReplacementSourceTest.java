package com.gentoro.kbgen.update;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kbgen.generation.RetryPolicy;
import com.gentoro.kbgen.generation.TextGenerationService;
import com.gentoro.kbgen.graph.Edge;
import com.gentoro.kbgen.graph.KnowledgeGraph;
import com.gentoro.kbgen.graph.SampleGraphs;
import com.gentoro.kbgen.model.LlmClient;
import com.gentoro.kbgen.prompt.impl.ClasspathPromptRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class GeneratedReplacementSourceTest {
  private final KnowledgeGraph graph = SampleGraphs.restaurantChain();
  private final List<List<LlmClient.Message>> prompts = new ArrayList<>();

  private GeneratedReplacementSource source(String reply) {
    LlmClient llm =
        messages -> {
          prompts.add(messages);
          return reply;
        };
    return new GeneratedReplacementSource(
        new TextGenerationService(
            llm, new ClasspathPromptRepository("prompts"), new RetryPolicy(1, 0, 0), 1));
  }

  @Test
  void proposesNewRelationshipTarget() {
    Replacement replacement =
        source("{\"newValue\": \" Jersey City \", \"utterances\": [\"B moved to Jersey City.\"]}")
            .propose(
                graph,
                "A",
                MutableFact.relationship(new Edge("B", "located_in", "C")),
                new Random(1));

    assertEquals("Jersey City", replacement.newValue());
    assertEquals(List.of("B moved to Jersey City."), replacement.utterances());
    String userPrompt = prompts.get(0).get(1).content();
    assertTrue(userPrompt.contains("located_in"), userPrompt);
    assertTrue(userPrompt.contains("C"), userPrompt);
  }

  @Test
  void proposesNewAttributeValue() {
    Replacement replacement =
        source("{\"newValue\": \"Mexican\", \"utterances\": [\"B serves Mexican food now.\"]}")
            .propose(graph, "A", MutableFact.attribute("B", "cuisine", "Italian"), new Random(1));

    assertEquals("Mexican", replacement.newValue());
    assertTrue(prompts.get(0).get(1).content().contains("Italian"));
  }
}
