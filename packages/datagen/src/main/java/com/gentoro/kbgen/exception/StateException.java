package com.gentoro.kbgen.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends KbGenException {
  public StateException(String message) {
    super(KbGenErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(KbGenErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
