package com.gentoro.kbgen.query;

import com.gentoro.kbgen.graph.KnowledgeGraph;
import java.util.ArrayList;
import java.util.List;

/**
 * A phrased question/answer pair.
 *
 * @param hopDistance 0, 1 or 2
 * @param path node names interleaved with relation labels, ending with {@code attribute=value}
 *     for attribute facts
 * @param attribute attribute key, or {@code null} for identity questions
 * @param question natural language question
 * @param answer expected answer
 */
public record QueryRecord(
    int hopDistance, List<String> path, String attribute, String question, String answer) {
  public QueryRecord {
    path = List.copyOf(path);
  }

  public static QueryRecord of(KnowledgeGraph graph, QueryFact fact, String question) {
    return new QueryRecord(
        fact.hopDistance(), fact.describe(graph), fact.attribute(), question, fact.answer());
  }

  /** Pair each fact with its phrased question; both lists must have the same size. */
  public static List<QueryRecord> assemble(
      KnowledgeGraph graph, List<QueryFact> facts, List<String> questions) {
    if (facts.size() != questions.size()) {
      throw new IllegalArgumentException(
          "Got %d question(s) for %d fact(s)".formatted(questions.size(), facts.size()));
    }
    List<QueryRecord> out = new ArrayList<>();
    for (int i = 0; i < facts.size(); i++) {
      out.add(of(graph, facts.get(i), questions.get(i)));
    }
    return out;
  }
}
