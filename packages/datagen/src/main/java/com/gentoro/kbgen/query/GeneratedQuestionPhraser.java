package com.gentoro.kbgen.query;

import com.gentoro.kbgen.exception.GenerationException;
import com.gentoro.kbgen.generation.TextGenerationService;
import com.gentoro.kbgen.graph.KnowledgeGraph;
import com.gentoro.kbgen.messages.PhrasedQuestion;
import com.gentoro.kbgen.messages.PhrasedQuestions;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Asks the text generation service to phrase all facts of one focal node in a single call. */
public class GeneratedQuestionPhraser implements QuestionPhraser {
  public static final String PROMPT_ID = "questions";

  private final TextGenerationService generationService;

  public GeneratedQuestionPhraser(TextGenerationService generationService) {
    this.generationService = generationService;
  }

  @Override
  public List<String> phrase(KnowledgeGraph graph, List<QueryFact> facts) {
    if (facts.isEmpty()) return List.of();
    List<Map<String, Object>> items = new ArrayList<>();
    for (int i = 0; i < facts.size(); i++) {
      QueryFact f = facts.get(i);
      Map<String, Object> item = new LinkedHashMap<>();
      item.put("index", i);
      item.put("hop", f.hopDistance());
      item.put("path", String.join(" -> ", f.path().describe(graph)));
      item.put("property", f.isIdentity() ? "name" : f.attribute());
      item.put("answer", f.answer());
      items.add(item);
    }
    String person = graph.node(facts.get(0).path().start()).getName();
    PhrasedQuestions reply =
        generationService.generate(
            PROMPT_ID,
            Map.of("person", person, "facts", items, "count", facts.size()),
            PhrasedQuestions.class);

    String[] out = new String[facts.size()];
    for (PhrasedQuestion q : reply.questions()) {
      if (q.index() < 0 || q.index() >= out.length || out[q.index()] != null) {
        throw new GenerationException(
            "Phrased question has an invalid or repeated index: " + q.index(), false);
      }
      out[q.index()] = q.question().trim();
    }
    if (reply.questions().size() != facts.size()) {
      throw new GenerationException(
          "Expected %d phrased question(s), got %d"
              .formatted(facts.size(), reply.questions().size()),
          false);
    }
    return List.of(out);
  }
}
