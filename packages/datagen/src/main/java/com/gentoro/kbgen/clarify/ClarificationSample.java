package com.gentoro.kbgen.clarify;

import java.util.Objects;

/**
 * A question the memory cannot answer as asked, with the reply the assistant should give.
 *
 * @param kind why the question needs clarification
 * @param question user question
 * @param answer clarifying reply
 * @param subjectNodeId node the question is about, or {@code null} when it names no real node
 * @param attribute attribute the question asks for or contradicts, when there is one
 * @param rationale short note on what makes the question unanswerable, may be {@code null}
 */
public record ClarificationSample(
    ClarificationKind kind,
    String question,
    String answer,
    String subjectNodeId,
    String attribute,
    String rationale) {
  public ClarificationSample {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(question, "question");
    Objects.requireNonNull(answer, "answer");
  }
}
