package com.gentoro.kbgen.model;

import com.gentoro.kbgen.exception.ConfigException;
import com.gentoro.kbgen.http.OkHttpFactory;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/** SPI provider for servers exposing the OpenAI Chat Completions API. */
public final class OpenAiCompatibleLlmClientProvider implements LlmClientProvider {

  @Override
  public String providerId() {
    return "openai-compatible";
  }

  @Override
  public LlmClient create(Configuration subConfiguration) {
    String baseUrl = subConfiguration.getString("base-url", "https://api.openai.com/v1");
    if (baseUrl == null || baseUrl.isBlank()) {
      throw new ConfigException("Missing llm.<profile>.base-url in configuration");
    }
    String apiKey = subConfiguration.getString("api-key", null);
    if (apiKey != null && apiKey.startsWith("${")) {
      // placeholder left unresolved: neither the environment nor .env.local define it
      apiKey = null;
    }
    if ((apiKey == null || apiKey.isBlank()) && baseUrl.contains("api.openai.com")) {
      throw new ConfigException("Missing llm.<profile>.api-key in configuration");
    }
    return new OpenAiCompatibleLlmClient(
        OkHttpFactory.create(
            Duration.ofMillis(subConfiguration.getLong("connect-timeout-ms", 10_000L)),
            Duration.ofMillis(subConfiguration.getLong("read-timeout-ms", 120_000L))),
        baseUrl,
        apiKey,
        subConfiguration);
  }
}
