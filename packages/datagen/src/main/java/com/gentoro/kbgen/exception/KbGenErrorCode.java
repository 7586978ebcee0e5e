package com.gentoro.kbgen.exception;

/**
 * Canonical error codes for kbgen. Codes are stable and suitable for summaries and logs. Prefer the
 * most specific code that reflects the failure origin and whether it is recoverable.
 */
public enum KbGenErrorCode {
  // Generic
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  PROMPT_ERROR,
  GENERATION_ERROR,
  GRAPH_INVALID,
  LINK_RESOLUTION_ERROR,
  NO_MUTABLE_FACT,
  MUTATION_EXHAUSTED,
}
