package com.gentoro.kbgen.pipeline;

import com.gentoro.kbgen.validation.Violation;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Result of running one scenario. A rejected graph carries its violations and no node results; a
 * graph that could not be built carries the build error and nothing else.
 */
public record ScenarioSummary(
    String scenarioName,
    String instanceId,
    Path outputDir,
    int nodeCount,
    int edgeCount,
    List<Violation> violations,
    List<FocalNodeResult> results,
    String buildError) {
  public ScenarioSummary {
    violations = List.copyOf(violations);
    results = List.copyOf(results);
  }

  public ScenarioSummary(
      String scenarioName,
      String instanceId,
      Path outputDir,
      int nodeCount,
      int edgeCount,
      List<Violation> violations,
      List<FocalNodeResult> results) {
    this(scenarioName, instanceId, outputDir, nodeCount, edgeCount, violations, results, null);
  }

  public static ScenarioSummary ofBuildFailure(
      String scenarioName, String instanceId, String buildError) {
    return new ScenarioSummary(
        scenarioName, instanceId, null, 0, 0, List.of(), List.of(), buildError);
  }

  public boolean rejected() {
    return !violations.isEmpty();
  }

  public boolean buildFailed() {
    return buildError != null;
  }

  public List<FocalNodeResult> withStatus(FocalNodeResult.Status status) {
    return results.stream().filter(r -> r.status() == status).toList();
  }

  /** Multi-line report for logs and the console. */
  public String describe() {
    StringBuilder sb = new StringBuilder();
    sb.append("Scenario ").append(scenarioName).append(" [").append(instanceId).append("]\n");
    if (buildFailed()) {
      sb.append("  BUILD FAILED: ").append(buildError).append('\n');
      return sb.toString();
    }
    sb.append("  graph: ")
        .append(nodeCount)
        .append(" node(s), ")
        .append(edgeCount)
        .append(" edge(s)\n");
    if (rejected()) {
      sb.append("  REJECTED with ").append(violations.size()).append(" violation(s):\n");
      for (Violation v : violations) {
        sb.append("    - ").append(v.invariant()).append(' ').append(v.subject());
        sb.append(": ").append(v.message()).append('\n');
      }
      return sb.toString();
    }
    sb.append("  output: ").append(outputDir).append('\n');
    for (FocalNodeResult.Status status : FocalNodeResult.Status.values()) {
      List<FocalNodeResult> group = withStatus(status);
      sb.append("  ").append(status.name().toLowerCase(Locale.ROOT)).append(": ");
      sb.append(group.size()).append('\n');
      for (FocalNodeResult r : group) {
        sb.append("    - ").append(r.focalNodeId());
        if (status == FocalNodeResult.Status.FAILED) {
          sb.append(": ").append(r.error());
        } else {
          sb.append(" (")
              .append(r.documents())
              .append(" docs, ")
              .append(r.questions())
              .append(" questions, ")
              .append(r.updates())
              .append(" updates, ")
              .append(r.clarifications())
              .append(" clarifications)");
        }
        sb.append('\n');
        for (String reason : r.skipReasons()) {
          sb.append("        skipped ").append(reason).append('\n');
        }
      }
    }
    return sb.toString();
  }
}
