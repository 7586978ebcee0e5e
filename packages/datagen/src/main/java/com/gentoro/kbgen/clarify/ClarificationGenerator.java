package com.gentoro.kbgen.clarify;

import com.gentoro.kbgen.graph.KnowledgeGraph;
import com.gentoro.kbgen.render.DocumentSet;
import java.util.Optional;
import java.util.Random;

/** Produces clarification samples for one focal node's memory. */
public interface ClarificationGenerator {

  /**
   * One sample of {@code kind} for the memory rendered in {@code documents}, or empty when the
   * memory offers nothing to build that kind from.
   *
   * @throws com.gentoro.kbgen.exception.GenerationException when a model-backed generator fails
   */
  Optional<ClarificationSample> generate(
      KnowledgeGraph graph, DocumentSet documents, ClarificationKind kind, Random random);
}
