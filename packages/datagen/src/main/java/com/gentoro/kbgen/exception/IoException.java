package com.gentoro.kbgen.exception;

/** Filesystem or stream failure while reading inputs or writing dataset records. */
public class IoException extends KbGenException {
  public IoException(String message) {
    super(KbGenErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(KbGenErrorCode.IO_ERROR, message, cause);
  }
}
