package com.gentoro.kbgen.exception;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends KbGenException {
  public ConfigException(String message) {
    super(KbGenErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(KbGenErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
