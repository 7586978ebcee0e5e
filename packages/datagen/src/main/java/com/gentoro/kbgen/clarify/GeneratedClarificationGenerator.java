package com.gentoro.kbgen.clarify;

import com.gentoro.kbgen.exception.GenerationException;
import com.gentoro.kbgen.generation.TextGenerationService;
import com.gentoro.kbgen.graph.KnowledgeGraph;
import com.gentoro.kbgen.messages.ClarificationReply;
import com.gentoro.kbgen.render.Document;
import com.gentoro.kbgen.render.DocumentSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Collectors;

/** Asks the text generation service for a clarification sample grounded in the rendered memory. */
public class GeneratedClarificationGenerator implements ClarificationGenerator {
  public static final String PROMPT_ID = "clarification";
  static final int MAX_MEMORY_CHARS = 6000;

  private final TextGenerationService generationService;

  public GeneratedClarificationGenerator(TextGenerationService generationService) {
    this.generationService = generationService;
  }

  @Override
  public Optional<ClarificationSample> generate(
      KnowledgeGraph graph, DocumentSet documents, ClarificationKind kind, Random random) {
    Map<String, Object> vars = new HashMap<>();
    vars.put("person", graph.node(documents.focalNodeId()).getName());
    vars.put("scenario", kind.label());
    vars.put("description", kind.description());
    vars.put("memory", memory(documents));
    ClarificationReply reply =
        generationService.generate(PROMPT_ID, vars, ClarificationReply.class);

    String question = reply.question().trim();
    String answer = reply.answer().trim();
    if (question.isEmpty() || answer.isEmpty()) {
      throw new GenerationException(
          "Clarification " + kind.label() + " came back with an empty question or answer", false);
    }
    String rationale = reply.rationale() == null ? null : reply.rationale().trim();
    return Optional.of(
        new ClarificationSample(kind, question, answer, null, null, rationale));
  }

  /** Markdown of every rendered document, cut after {@value #MAX_MEMORY_CHARS} characters. */
  static String memory(DocumentSet documents) {
    String all =
        documents.documents().values().stream()
            .map(Document::toMarkdown)
            .map(String::strip)
            .collect(Collectors.joining("\n\n"));
    if (all.length() <= MAX_MEMORY_CHARS) return all;
    return all.substring(0, MAX_MEMORY_CHARS) + "\n\n...";
  }
}
