package com.gentoro.kbgen.query;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kbgen.graph.KnowledgeGraph;
import com.gentoro.kbgen.graph.SampleGraphs;
import java.util.List;
import org.junit.jupiter.api.Test;

class TemplateQuestionPhraserTest {

  private final TemplateQuestionPhraser phraser = new TemplateQuestionPhraser();
  private final QueryDeriver deriver = new QueryDeriver();

  @Test
  void phrasesEachHop() {
    KnowledgeGraph g = SampleGraphs.restaurantChain();
    List<String> questions = phraser.phrase(g, deriver.enumerate(g, "A"));
    assertEquals(
        List.of(
            "What is the age of A?",
            "What is the name of the restaurant that A works at?",
            "What is the cuisine of the restaurant that A works at?",
            "What is the name of the city that the restaurant that A works at located in?",
            "What is the population of the city that the restaurant that A works at located in?"),
        questions);
  }

  @Test
  void incomingEdgesPutTheRelationFirst() {
    KnowledgeGraph g = SampleGraphs.restaurantChain();
    List<QueryFact> facts = deriver.enumerate(g, "C");
    assertEquals(
        "What is the name of the restaurant that located in C?", phraser.question(g, facts.get(1)));
  }
}
