package com.gentoro.kbgen.model;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.kbgen.exception.GenerationException;
import com.gentoro.kbgen.utility.JacksonUtility;
import java.util.List;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenAiCompatibleLlmClientTest {
  private static final String REPLY =
      """
      {"id": "cmpl-1",
       "choices": [{"index": 0, "message": {"role": "assistant", "content": "{\\"ok\\": true}"}}],
       "usage": {"prompt_tokens": 12, "completion_tokens": 4}}
      """;

  private MockWebServer server;
  private BaseConfiguration configuration;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    configuration = new BaseConfiguration();
    configuration.setProperty("model", "test-model");
    configuration.setProperty("temperature", 0.2);
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  private OpenAiCompatibleLlmClient client(String apiKey) {
    return new OpenAiCompatibleLlmClient(
        new OkHttpClient(), server.url("/v1/").toString(), apiKey, configuration);
  }

  @Test
  void postsChatCompletionAndReturnsContent() throws Exception {
    server.enqueue(new MockResponse().setBody(REPLY));

    String reply =
        client("sk-test")
            .chat(List.of(LlmClient.Message.system("Be brief"), LlmClient.Message.user("Hi")));

    assertEquals("{\"ok\": true}", reply);
    RecordedRequest request = server.takeRequest();
    assertEquals("POST", request.getMethod());
    assertEquals("/v1/chat/completions", request.getPath());
    assertEquals("Bearer sk-test", request.getHeader("Authorization"));

    JsonNode payload = JacksonUtility.getJsonMapper().readTree(request.getBody().readUtf8());
    assertEquals("test-model", payload.path("model").asText());
    assertEquals(0.2, payload.path("temperature").asDouble(), 1e-9);
    assertEquals("json_object", payload.path("response_format").path("type").asText());
    assertEquals("system", payload.path("messages").path(0).path("role").asText());
    assertEquals("Hi", payload.path("messages").path(1).path("content").asText());
  }

  @Test
  void omitsAuthorizationWithoutKeyAndHonorsJsonModeFlag() throws Exception {
    configuration.setProperty("json-mode", false);
    server.enqueue(new MockResponse().setBody(REPLY));

    client(null).chat(List.of(LlmClient.Message.user("Hi")));

    RecordedRequest request = server.takeRequest();
    assertNull(request.getHeader("Authorization"));
    JsonNode payload = JacksonUtility.getJsonMapper().readTree(request.getBody().readUtf8());
    assertTrue(payload.path("response_format").isMissingNode());
  }

  @Test
  void rateLimitingIsRetryable() {
    server.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));
    GenerationException ex =
        assertThrows(
            GenerationException.class,
            () -> client("k").chat(List.of(LlmClient.Message.user("Hi"))));
    assertTrue(ex.isRetryable());
    assertTrue(ex.getMessage().contains("HTTP 429"));
  }

  @Test
  void serverErrorIsRetryable() {
    server.enqueue(new MockResponse().setResponseCode(502));
    GenerationException ex =
        assertThrows(
            GenerationException.class,
            () -> client("k").chat(List.of(LlmClient.Message.user("Hi"))));
    assertTrue(ex.isRetryable());
  }

  @Test
  void clientErrorIsNotRetryable() {
    server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"error\":\"bad model\"}"));
    GenerationException ex =
        assertThrows(
            GenerationException.class,
            () -> client("k").chat(List.of(LlmClient.Message.user("Hi"))));
    assertFalse(ex.isRetryable());
    assertTrue(ex.getMessage().contains("bad model"));
  }

  @Test
  void responseWithoutContentFails() {
    server.enqueue(new MockResponse().setBody("{\"choices\": []}"));
    GenerationException ex =
        assertThrows(
            GenerationException.class,
            () -> client("k").chat(List.of(LlmClient.Message.user("Hi"))));
    assertTrue(ex.getMessage().contains("no message content"));
  }
}
