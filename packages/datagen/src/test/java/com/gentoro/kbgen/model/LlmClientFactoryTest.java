package com.gentoro.kbgen.model;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kbgen.exception.ConfigException;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;

class LlmClientFactoryTest {

  private static BaseConfiguration profile(String name, String provider, String baseUrl) {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("llm.active-profile", name);
    cfg.setProperty("llm." + name + ".provider", provider);
    cfg.setProperty("llm." + name + ".base-url", baseUrl);
    return cfg;
  }

  @Test
  void createsClientForActiveProfile() {
    LlmClient client =
        LlmClientFactory.createProvider(
            profile("local", "OpenAI-Compatible", "http://localhost:11434/v1"));
    assertInstanceOf(OpenAiCompatibleLlmClient.class, client);
  }

  @Test
  void rejectsUnknownProviderAndMissingProfile() {
    assertThrows(
        ConfigException.class,
        () -> LlmClientFactory.createProvider(profile("local", "telepathy", "http://x")));

    BaseConfiguration noProfile = new BaseConfiguration();
    noProfile.setProperty("llm.active-profile", "nowhere");
    assertThrows(ConfigException.class, () -> LlmClientFactory.createProvider(noProfile));
  }

  @Test
  void hostedEndpointNeedsResolvedApiKey() {
    BaseConfiguration cfg = profile("default", "openai-compatible", "https://api.openai.com/v1");
    cfg.setProperty("llm.default.api-key", "${env:KBGEN_TEST_ONLY_UNSET}");
    assertThrows(ConfigException.class, () -> LlmClientFactory.createProvider(cfg));

    cfg.setProperty("llm.default.api-key", "sk-test");
    assertInstanceOf(OpenAiCompatibleLlmClient.class, LlmClientFactory.createProvider(cfg));
  }
}
