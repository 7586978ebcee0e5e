package com.gentoro.kbgen.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends KbGenException {
  public ValidationException(String message) {
    super(KbGenErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(KbGenErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
