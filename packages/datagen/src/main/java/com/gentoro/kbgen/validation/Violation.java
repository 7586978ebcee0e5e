package com.gentoro.kbgen.validation;

/**
 * One broken invariant.
 *
 * @param invariant which invariant failed
 * @param subject the offending node id, or the edge in {@code source -label-> target} form
 * @param message human readable description
 */
public record Violation(InvariantId invariant, String subject, String message) {
  @Override
  public String toString() {
    return invariant + "[" + subject + "]: " + message;
  }
}
