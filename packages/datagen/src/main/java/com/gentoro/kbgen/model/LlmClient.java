package com.gentoro.kbgen.model;

import java.util.List;

/**
 * Primary abstraction for talking to a Large Language Model provider.
 *
 * <p>kbgen only needs single-turn completions: a list of role-tagged messages goes in, the model's
 * text comes out. Concrete providers live behind this interface and are selected through {@link
 * LlmClientFactory} and the {@link java.util.ServiceLoader} managed SPI {@link LlmClientProvider}.
 */
public interface LlmClient {
  /**
   * Run one completion.
   *
   * @return the model's reply text
   * @throws com.gentoro.kbgen.exception.GenerationException when the provider fails
   */
  String chat(List<Message> messages);

  enum Role {
    SYSTEM,
    ASSISTANT,
    USER
  }

  record Message(Role role, String content) {
    public static Message system(String content) {
      return new Message(Role.SYSTEM, content);
    }

    public static Message user(String content) {
      return new Message(Role.USER, content);
    }

    static List<Message> allExcept(List<Message> messages, Role role) {
      return messages.stream().filter(m -> !m.role().equals(role)).toList();
    }

    static boolean contains(List<Message> messages, Role role) {
      return messages.stream().anyMatch(m -> m.role().equals(role));
    }
  }
}
