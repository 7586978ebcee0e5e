package com.gentoro.kbgen.pipeline;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of one focal node pass.
 *
 * @param focalNodeId person the pass was run for
 * @param status overall outcome
 * @param documents documents rendered
 * @param questions question/answer pairs written
 * @param updates update scenarios written
 * @param clarifications clarification samples written
 * @param skipReasons artifacts that were skipped and why; non-empty only for {@link
 *     Status#PARTIAL}
 * @param error failure summary for {@link Status#FAILED}
 * @param outputDir directory the artifacts were written to, {@code null} when nothing was written
 */
public record FocalNodeResult(
    String focalNodeId,
    Status status,
    int documents,
    int questions,
    int updates,
    int clarifications,
    List<String> skipReasons,
    String error,
    Path outputDir) {

  public enum Status {
    SUCCEEDED,
    PARTIAL,
    FAILED
  }

  public FocalNodeResult {
    skipReasons = List.copyOf(skipReasons);
  }

  public static FocalNodeResult completed(
      String focalNodeId,
      int documents,
      int questions,
      int updates,
      int clarifications,
      List<String> skipReasons,
      Path outputDir) {
    Status status = skipReasons.isEmpty() ? Status.SUCCEEDED : Status.PARTIAL;
    return new FocalNodeResult(
        focalNodeId,
        status,
        documents,
        questions,
        updates,
        clarifications,
        skipReasons,
        null,
        outputDir);
  }

  public static FocalNodeResult failed(String focalNodeId, String error) {
    return new FocalNodeResult(focalNodeId, Status.FAILED, 0, 0, 0, 0, List.of(), error, null);
  }
}
