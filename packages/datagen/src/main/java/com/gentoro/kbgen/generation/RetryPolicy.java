package com.gentoro.kbgen.generation;

import com.gentoro.kbgen.exception.ValidationException;
import org.apache.commons.configuration2.Configuration;

/** Bounded attempts with exponential backoff, capped at {@code maxBackoffMs}. */
public record RetryPolicy(int maxAttempts, long initialBackoffMs, long maxBackoffMs) {
  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new ValidationException("maxAttempts must be >= 1, got " + maxAttempts);
    }
    if (initialBackoffMs < 0 || maxBackoffMs < initialBackoffMs) {
      throw new ValidationException(
          "Invalid backoff range [%d, %d]".formatted(initialBackoffMs, maxBackoffMs));
    }
  }

  public static RetryPolicy fromConfiguration(Configuration cfg) {
    return new RetryPolicy(
        cfg.getInt("generation.max-attempts", 3),
        cfg.getLong("generation.initial-backoff-ms", 500L),
        cfg.getLong("generation.max-backoff-ms", 8_000L));
  }

  /** Delay before attempt {@code attempt + 1}, where {@code attempt} starts at 1. */
  public long backoffAfter(int attempt) {
    long delay = initialBackoffMs;
    for (int i = 1; i < attempt && delay < maxBackoffMs; i++) {
      delay *= 2;
    }
    return Math.min(delay, maxBackoffMs);
  }
}
