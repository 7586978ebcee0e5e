package com.gentoro.kbgen.exception;

import java.util.List;
import java.util.Map;

/** Every attempted mutation produced an invalid or unusable graph within the retry budget. */
public class MutationExhaustedException extends KbGenException {
  private final List<String> rejections;

  public MutationExhaustedException(String focalNodeId, List<String> rejections) {
    super(
        KbGenErrorCode.MUTATION_EXHAUSTED,
        "Gave up on updating the neighborhood of node %s after %d attempt(s)"
            .formatted(focalNodeId, rejections.size()),
        Map.of("focalNodeId", focalNodeId, "rejections", List.copyOf(rejections)));
    this.rejections = List.copyOf(rejections);
  }

  /** One human readable reason per rejected attempt, in attempt order. */
  public List<String> getRejections() {
    return rejections;
  }
}
