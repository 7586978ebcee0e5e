package com.gentoro.kbgen.query;

import com.gentoro.kbgen.graph.Direction;
import com.gentoro.kbgen.graph.EdgeStep;
import com.gentoro.kbgen.graph.KnowledgeGraph;
import com.gentoro.kbgen.utility.StringUtility;
import java.util.List;

/**
 * Deterministic English questions built from the fact path, for example "What is the cuisine of
 * the restaurant that Alice works at?".
 */
public class TemplateQuestionPhraser implements QuestionPhraser {

  @Override
  public List<String> phrase(KnowledgeGraph graph, List<QueryFact> facts) {
    return facts.stream().map(f -> question(graph, f)).toList();
  }

  public String question(KnowledgeGraph graph, QueryFact fact) {
    String property = fact.isIdentity() ? "name" : StringUtility.phrase(fact.attribute());
    return "What is the " + property + " of " + describe(graph, fact, fact.path().length()) + "?";
  }

  /** Referring expression for the node at position {@code upTo} of the fact path. */
  private String describe(KnowledgeGraph graph, QueryFact fact, int upTo) {
    List<String> ids = fact.path().nodeIds();
    if (upTo == 0) {
      return graph.node(ids.get(0)).getName();
    }
    EdgeStep step = fact.path().steps().get(upTo - 1);
    String type = StringUtility.phrase(graph.node(ids.get(upTo)).getType());
    String relation = StringUtility.phrase(step.label());
    String previous = describe(graph, fact, upTo - 1);
    if (step.direction() == Direction.OUTGOING) {
      return "the " + type + " that " + previous + " " + relation;
    }
    return "the " + type + " that " + relation + " " + previous;
  }
}
