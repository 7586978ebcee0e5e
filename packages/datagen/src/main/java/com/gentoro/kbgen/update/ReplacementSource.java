package com.gentoro.kbgen.update;

import com.gentoro.kbgen.graph.KnowledgeGraph;
import java.util.Random;

/** Supplies the new value for a fact selected by the {@link UpdateSimulator}. */
public interface ReplacementSource {
  Replacement propose(KnowledgeGraph graph, String focalNodeId, MutableFact fact, Random random);
}
