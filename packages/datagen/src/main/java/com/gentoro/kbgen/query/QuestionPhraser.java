package com.gentoro.kbgen.query;

import com.gentoro.kbgen.graph.KnowledgeGraph;
import java.util.List;

/** Turns structural facts into natural language questions, one per fact and in the same order. */
public interface QuestionPhraser {
  List<String> phrase(KnowledgeGraph graph, List<QueryFact> facts);
}
