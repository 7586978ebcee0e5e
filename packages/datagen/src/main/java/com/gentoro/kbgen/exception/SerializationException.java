package com.gentoro.kbgen.exception;

/** Serialization/deserialization failure (JSON/YAML). */
public class SerializationException extends KbGenException {
  public SerializationException(String message) {
    super(KbGenErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(KbGenErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
