package com.gentoro.kbgen.prompt;

/** Source of prompt templates, looked up by id. */
public interface PromptRepository {
  /**
   * @throws com.gentoro.kbgen.exception.NotFoundException when no template has that id
   * @throws com.gentoro.kbgen.exception.PromptException when the template cannot be parsed
   */
  PromptTemplate get(String id);
}
