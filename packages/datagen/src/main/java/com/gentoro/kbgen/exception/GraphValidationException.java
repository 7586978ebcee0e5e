package com.gentoro.kbgen.exception;

import com.gentoro.kbgen.validation.Violation;
import java.util.List;
import java.util.Map;

/**
 * A knowledge graph broke one or more structural invariants. Carries every violation found, not
 * just the first, so the scenario summary can report all of them at once.
 */
public class GraphValidationException extends KbGenException {
  private final List<Violation> violations;

  public GraphValidationException(List<Violation> violations) {
    super(
        KbGenErrorCode.GRAPH_INVALID,
        "Knowledge graph failed validation with %d violation(s)".formatted(violations.size()),
        Map.of("violations", violations.size()));
    this.violations = List.copyOf(violations);
  }

  public List<Violation> getViolations() {
    return violations;
  }
}
