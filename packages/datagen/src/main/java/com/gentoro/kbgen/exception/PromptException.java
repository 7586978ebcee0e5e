package com.gentoro.kbgen.exception;

/** Prompt retrieval, parsing, rendering, or repository initialization error. */
public class PromptException extends KbGenException {
  public PromptException(String message) {
    super(KbGenErrorCode.PROMPT_ERROR, message);
  }

  public PromptException(String message, Throwable cause) {
    super(KbGenErrorCode.PROMPT_ERROR, message, cause);
  }
}
