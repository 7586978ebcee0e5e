package com.gentoro.kbgen.validation;

import com.gentoro.kbgen.exception.GraphValidationException;
import java.util.List;

public record ValidationResult(boolean ok, List<Violation> violations) {
  public ValidationResult {
    violations = List.copyOf(violations);
    if (ok != violations.isEmpty()) {
      throw new IllegalArgumentException("ok must be true exactly when there are no violations");
    }
  }

  public static ValidationResult of(List<Violation> violations) {
    return new ValidationResult(violations.isEmpty(), violations);
  }

  public List<Violation> violationsOf(InvariantId invariant) {
    return violations.stream().filter(v -> v.invariant() == invariant).toList();
  }

  /** Returns {@code this} when valid, otherwise raises a {@link GraphValidationException}. */
  public ValidationResult orThrow() {
    if (!ok) throw new GraphValidationException(violations);
    return this;
  }
}
