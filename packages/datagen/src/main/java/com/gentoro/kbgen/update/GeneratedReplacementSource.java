package com.gentoro.kbgen.update;

import com.gentoro.kbgen.generation.TextGenerationService;
import com.gentoro.kbgen.graph.KnowledgeGraph;
import com.gentoro.kbgen.graph.Node;
import com.gentoro.kbgen.messages.UpdatePhrasing;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * Asks the text generation service for a plausible new value together with the user utterances
 * requesting the change.
 */
public class GeneratedReplacementSource implements ReplacementSource {
  public static final String PROMPT_ID = "update";

  private final TextGenerationService generationService;

  public GeneratedReplacementSource(TextGenerationService generationService) {
    this.generationService = generationService;
  }

  @Override
  public Replacement propose(
      KnowledgeGraph graph, String focalNodeId, MutableFact fact, Random random) {
    Node node = graph.node(fact.nodeId());
    Map<String, Object> vars = new HashMap<>();
    vars.put("person", graph.node(focalNodeId).getName());
    vars.put("kind", fact.kind().name().toLowerCase(Locale.ROOT));
    vars.put("node", node.getName());
    vars.put("nodeType", node.getType());
    vars.put("field", fact.field());
    vars.put(
        "currentValue",
        fact.kind() == UpdateKind.ATTRIBUTE
            ? String.valueOf(fact.currentValue())
            : graph.node(fact.edge().target()).getName());
    UpdatePhrasing reply = generationService.generate(PROMPT_ID, vars, UpdatePhrasing.class);
    return new Replacement(reply.newValue().trim(), reply.utterances());
  }
}
