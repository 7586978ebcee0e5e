package com.gentoro.kbgen.exception;

/** Resource requested was not found. */
public class NotFoundException extends KbGenException {
  public NotFoundException(String message) {
    super(KbGenErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(KbGenErrorCode.NOT_FOUND, message, cause);
  }
}
