package com.gentoro.kbgen.http;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import okhttp3.Headers;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.Test;

class LoggingInterceptorTest {

  @Test
  void redactsAuthorizationOnly() {
    Headers headers =
        new Headers.Builder()
            .add("Authorization", "Bearer sk-secret")
            .add("Content-Type", "application/json")
            .build();

    Headers redacted = LoggingInterceptor.redact(headers);

    assertEquals("Bearer ***", redacted.get("Authorization"));
    assertEquals("application/json", redacted.get("Content-Type"));
    assertFalse(redacted.toString().contains("sk-secret"));
  }

  @Test
  void headersWithoutAuthorizationAreUntouched() {
    Headers headers = Headers.of("Accept", "application/json");
    assertSame(headers, LoggingInterceptor.redact(headers));
  }

  @Test
  void passesRequestsThrough() throws Exception {
    try (MockWebServer server = new MockWebServer()) {
      server.enqueue(new MockResponse().setBody("pong"));
      OkHttpClient client = OkHttpFactory.create(Duration.ofSeconds(5), Duration.ofSeconds(5));

      try (Response response =
          client.newCall(new Request.Builder().url(server.url("/ping")).build()).execute()) {
        assertEquals(200, response.code());
        assertEquals("pong", response.body().string());
      }
      assertEquals("/ping", server.takeRequest().getPath());
    }
  }
}
