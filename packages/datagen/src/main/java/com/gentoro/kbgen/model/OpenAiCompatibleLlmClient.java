package com.gentoro.kbgen.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.kbgen.exception.GenerationException;
import com.gentoro.kbgen.utility.JacksonUtility;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.configuration2.Configuration;

/**
 * {@link LlmClient} speaking the OpenAI Chat Completions HTTP API, which most hosted and local
 * model servers also expose.
 *
 * <p>Rate limiting (429) and server errors (5xx) surface as retryable {@link GenerationException}s;
 * other HTTP errors are not retried.
 */
public class OpenAiCompatibleLlmClient extends AbstractLlmClient {
  private static final org.slf4j.Logger log =
      com.gentoro.kbgen.logging.LoggingService.getLogger(OpenAiCompatibleLlmClient.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient httpClient;
  private final String endpoint;
  private final String apiKey;

  public OpenAiCompatibleLlmClient(
      OkHttpClient httpClient, String baseUrl, String apiKey, Configuration configuration) {
    super(configuration);
    this.httpClient = httpClient;
    this.endpoint = baseUrl.replaceAll("/+$", "") + "/chat/completions";
    this.apiKey = apiKey;
  }

  @Override
  protected String runInference(List<Message> messages) {
    ObjectMapper mapper = JacksonUtility.getJsonMapper();
    String payload;
    try {
      payload = mapper.writeValueAsString(buildPayload(mapper, messages));
    } catch (IOException e) {
      throw new GenerationException("Failed to encode chat completion request", e, false);
    }

    Request.Builder request =
        new Request.Builder().url(endpoint).post(RequestBody.create(payload, JSON));
    if (apiKey != null && !apiKey.isBlank()) {
      request.header("Authorization", "Bearer " + apiKey);
    }

    try (Response response = httpClient.newCall(request.build()).execute()) {
      ResponseBody body = response.body();
      String text = body == null ? "" : body.string();
      if (!response.isSuccessful()) {
        boolean retryable = response.code() == 429 || response.code() >= 500;
        throw new GenerationException(
            "Chat completion failed with HTTP %d: %s".formatted(response.code(), abbreviate(text)),
            retryable);
      }
      return extractContent(mapper, text);
    } catch (IOException e) {
      throw new GenerationException("Chat completion request failed: " + e.getMessage(), e, true);
    }
  }

  private ObjectNode buildPayload(ObjectMapper mapper, List<Message> messages) {
    ObjectNode root = mapper.createObjectNode();
    root.put("model", configuration.getString("model", "gpt-4.1-mini"));
    root.put("temperature", configuration.getDouble("temperature", 0.7));
    if (configuration.getBoolean("json-mode", true)) {
      root.putObject("response_format").put("type", "json_object");
    }
    ArrayNode arr = root.putArray("messages");
    for (Message m : messages) {
      arr.addObject()
          .put("role", m.role().name().toLowerCase(Locale.ROOT))
          .put("content", m.content());
    }
    return root;
  }

  private static String extractContent(ObjectMapper mapper, String text) {
    JsonNode root;
    try {
      root = mapper.readTree(text);
    } catch (IOException e) {
      throw new GenerationException("Chat completion response is not JSON", e, true);
    }
    JsonNode content = root.path("choices").path(0).path("message").path("content");
    if (!content.isTextual()) {
      throw new GenerationException("Chat completion response has no message content", true);
    }
    JsonNode usage = root.path("usage");
    if (!usage.isMissingNode()) {
      log.debug(
          "Token usage: prompt={}, completion={}",
          usage.path("prompt_tokens").asInt(),
          usage.path("completion_tokens").asInt());
    }
    return content.asText();
  }

  private static String abbreviate(String s) {
    return s.length() <= 500 ? s : s.substring(0, 500) + "...";
  }
}
