package com.gentoro.kbgen.generation;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kbgen.exception.GenerationException;
import com.gentoro.kbgen.messages.FieldDoc;
import com.gentoro.kbgen.model.LlmClient;
import com.gentoro.kbgen.prompt.impl.ClasspathPromptRepository;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class TextGenerationServiceTest {

  public record Greeting(@FieldDoc(description = "Greeting text", required = true) String text) {}

  /** Replays queued replies; a queued exception is thrown instead of returned. */
  static final class ScriptedLlmClient implements LlmClient {
    final Deque<Object> replies = new ArrayDeque<>();
    final List<List<Message>> calls = new ArrayList<>();

    ScriptedLlmClient then(Object reply) {
      replies.add(reply);
      return this;
    }

    @Override
    public String chat(List<Message> messages) {
      calls.add(messages);
      Object next = replies.poll();
      if (next instanceof RuntimeException e) throw e;
      if (next == null) throw new IllegalStateException("No scripted reply left");
      return (String) next;
    }
  }

  private ScriptedLlmClient llm;
  private List<Long> sleeps;
  private TextGenerationService service;

  @BeforeEach
  void setUp() {
    llm = new ScriptedLlmClient();
    sleeps = new ArrayList<>();
    service =
        new TextGenerationService(
            llm,
            new ClasspathPromptRepository("test-prompts"),
            new RetryPolicy(3, 10, 100),
            2,
            sleeps::add);
  }

  private static List<LlmClient.Message> ask() {
    return List.of(LlmClient.Message.user("Say hi"));
  }

  @Test
  void parsesReplyWrappedInProse() {
    llm.then("Sure! ```json\n{\"text\": \"hi\", \"mood\": \"happy\"}\n``` Enjoy.");
    assertEquals(new Greeting("hi"), service.generate(ask(), Greeting.class));
    assertTrue(sleeps.isEmpty());
  }

  @Test
  @DisplayName("Malformed output is retried after the initial backoff")
  void retriesMalformedOutput() {
    llm.then("no json here").then("{\"text\": \"hello\"}");
    assertEquals(new Greeting("hello"), service.generate(ask(), Greeting.class));
    assertEquals(List.of(10L), sleeps);
    assertEquals(2, llm.calls.size());
  }

  @Test
  void missingRequiredFieldIsRetried() {
    llm.then("{\"text\": \"  \"}").then("{\"text\": \"hey\"}");
    assertEquals(new Greeting("hey"), service.generate(ask(), Greeting.class));
    assertEquals(List.of(10L), sleeps);
  }

  @Test
  void nonRetryableFailureIsThrownImmediately() {
    llm.then(new GenerationException("HTTP 400", false)).then("{\"text\": \"unused\"}");
    GenerationException ex =
        assertThrows(GenerationException.class, () -> service.generate(ask(), Greeting.class));
    assertFalse(ex.isRetryable());
    assertTrue(ex.getMessage().contains("HTTP 400"));
    assertEquals(1, llm.calls.size());
    assertTrue(sleeps.isEmpty());
  }

  @Test
  @DisplayName("Exhausted retries back off exponentially and end in a terminal failure")
  void exhaustsRetries() {
    llm.then(new GenerationException("HTTP 503"))
        .then(new GenerationException("HTTP 503"))
        .then(new GenerationException("HTTP 429"));
    GenerationException ex =
        assertThrows(GenerationException.class, () -> service.generate(ask(), Greeting.class));
    assertEquals("Generation of Greeting failed: HTTP 429", ex.getMessage());
    assertFalse(ex.isRetryable());
    assertEquals(List.of(10L, 20L), sleeps);
    assertEquals(3, llm.calls.size());
  }

  @Test
  void rendersTemplateWithSchema() {
    llm.then("{\"text\": \"Good day, Ada\"}");
    Greeting greeting =
        service.generate("greeting", Map.of("name", "Ada", "formal", true), Greeting.class);

    assertEquals("Good day, Ada", greeting.text());
    List<LlmClient.Message> sent = llm.calls.get(0);
    assertEquals(2, sent.size());
    assertEquals(LlmClient.Role.SYSTEM, sent.get(0).role());
    assertTrue(sent.get(0).content().contains("\"text\""));
    assertEquals(LlmClient.Message.user("Greet Ada formally."), sent.get(1));
  }

  @Test
  void backoffIsCapped() {
    RetryPolicy policy = new RetryPolicy(10, 500, 2_000);
    assertEquals(500, policy.backoffAfter(1));
    assertEquals(1_000, policy.backoffAfter(2));
    assertEquals(2_000, policy.backoffAfter(3));
    assertEquals(2_000, policy.backoffAfter(9));
  }
}
