package com.gentoro.kbgen.exception;

/**
 * The text generation service failed, timed out or returned output that does not conform to the
 * requested schema. {@link #isRetryable()} tells the caller whether another attempt may succeed.
 */
public class GenerationException extends KbGenException {
  private final boolean retryable;

  public GenerationException(String message) {
    this(message, true);
  }

  public GenerationException(String message, boolean retryable) {
    super(KbGenErrorCode.GENERATION_ERROR, message);
    this.retryable = retryable;
  }

  public GenerationException(String message, Throwable cause) {
    this(message, cause, true);
  }

  public GenerationException(String message, Throwable cause, boolean retryable) {
    super(KbGenErrorCode.GENERATION_ERROR, message, cause);
    this.retryable = retryable;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
