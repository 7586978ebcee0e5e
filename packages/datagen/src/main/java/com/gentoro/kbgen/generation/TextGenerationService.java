package com.gentoro.kbgen.generation;

import com.gentoro.kbgen.exception.GenerationException;
import com.gentoro.kbgen.exception.ValidationException;
import com.gentoro.kbgen.messages.JsonSchemaGenerator;
import com.gentoro.kbgen.model.LlmClient;
import com.gentoro.kbgen.prompt.PromptRepository;
import com.gentoro.kbgen.utility.JacksonUtility;
import com.gentoro.kbgen.utility.StringUtility;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Semaphore;
import org.apache.commons.configuration2.Configuration;

/**
 * Structured text generation on top of an {@link LlmClient}.
 *
 * <p>Every call asks for a JSON object matching a {@link com.gentoro.kbgen.messages.FieldDoc}
 * annotated record. The reply is parsed with Jackson and checked for required fields; malformed
 * output and transient provider failures are retried with exponential backoff. The number of
 * in-flight model calls is bounded by a semaphore shared by all callers of this instance.
 */
public class TextGenerationService {
  private static final org.slf4j.Logger log =
      com.gentoro.kbgen.logging.LoggingService.getLogger(TextGenerationService.class);

  /** Blocking pause between attempts; replaced in tests. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }

  private final LlmClient llmClient;
  private final PromptRepository prompts;
  private final RetryPolicy retryPolicy;
  private final Semaphore permits;
  private final Sleeper sleeper;

  public TextGenerationService(
      LlmClient llmClient, PromptRepository prompts, RetryPolicy retryPolicy, int maxConcurrency) {
    this(llmClient, prompts, retryPolicy, maxConcurrency, Thread::sleep);
  }

  public TextGenerationService(
      LlmClient llmClient,
      PromptRepository prompts,
      RetryPolicy retryPolicy,
      int maxConcurrency,
      Sleeper sleeper) {
    if (maxConcurrency < 1) {
      throw new ValidationException("maxConcurrency must be >= 1, got " + maxConcurrency);
    }
    this.llmClient = llmClient;
    this.prompts = prompts;
    this.retryPolicy = retryPolicy;
    this.permits = new Semaphore(maxConcurrency, true);
    this.sleeper = sleeper;
  }

  public static TextGenerationService fromConfiguration(
      LlmClient llmClient, PromptRepository prompts, Configuration cfg) {
    return new TextGenerationService(
        llmClient,
        prompts,
        RetryPolicy.fromConfiguration(cfg),
        cfg.getInt("generation.max-concurrency", 4));
  }

  /**
   * Render prompt {@code templateId} with {@code vars} plus a {@code schema} variable describing
   * {@code schemaClass}, then generate.
   */
  public <T> T generate(String templateId, Map<String, Object> vars, Class<T> schemaClass) {
    Map<String, Object> ctx = new HashMap<>(vars);
    ctx.put("schema", JsonSchemaGenerator.describe(schemaClass));
    List<LlmClient.Message> messages =
        prompts.get(templateId).newSession().enableDefaults(ctx).renderMessages();
    return generate(messages, schemaClass);
  }

  public <T> T generate(List<LlmClient.Message> messages, Class<T> schemaClass) {
    GenerationException last = null;
    for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
      try {
        return attempt(messages, schemaClass);
      } catch (GenerationException e) {
        last = e;
        if (!e.isRetryable() || attempt == retryPolicy.maxAttempts()) break;
        long delay = retryPolicy.backoffAfter(attempt);
        log.warn(
            "Generation attempt {}/{} for {} failed ({}); retrying in {} ms",
            attempt,
            retryPolicy.maxAttempts(),
            schemaClass.getSimpleName(),
            e.getMessage(),
            delay);
        pause(delay);
      }
    }
    throw new GenerationException(
        "Generation of %s failed: %s".formatted(schemaClass.getSimpleName(), last.getMessage()),
        last,
        false);
  }

  private <T> T attempt(List<LlmClient.Message> messages, Class<T> schemaClass) {
    String reply;
    try {
      permits.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GenerationException("Generation cancelled", e, false);
    }
    try {
      reply = llmClient.chat(messages);
    } finally {
      permits.release();
    }
    return parse(reply, schemaClass);
  }

  static <T> T parse(String reply, Class<T> schemaClass) {
    String json = StringUtility.extractJsonObject(reply);
    if (json == null) {
      throw new GenerationException("Model reply contains no JSON object");
    }
    T value;
    try {
      value = JacksonUtility.getJsonMapper().readValue(json, schemaClass);
    } catch (Exception e) {
      String message =
          "Model reply does not match %s: %s"
              .formatted(schemaClass.getSimpleName(), e.getMessage());
      throw new GenerationException(message, e);
    }
    List<String> missing = JsonSchemaGenerator.missingRequired(value);
    if (!missing.isEmpty()) {
      throw new GenerationException(
          "Model reply is missing required field(s) %s of %s"
              .formatted(missing, schemaClass.getSimpleName()));
    }
    return value;
  }

  private void pause(long millis) {
    try {
      sleeper.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GenerationException("Generation cancelled", e, false);
    }
  }
}
