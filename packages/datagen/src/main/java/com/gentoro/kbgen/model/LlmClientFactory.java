package com.gentoro.kbgen.model;

import com.gentoro.kbgen.exception.ConfigException;
import java.util.Locale;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;

/** Creates {@link LlmClient} instances from configuration through the provider SPI. */
public final class LlmClientFactory {
  private LlmClientFactory() {}

  /**
   * Creates a client for the active profile under the {@code llm.*} namespace.
   *
   * <pre>
   *   llm.active-profile = default
   *   llm.default.provider = openai-compatible
   *   llm.default.api-key = sk-...
   * </pre>
   */
  public static LlmClient createProvider(Configuration configuration) {
    String namespace = configuration.getString("llm.active-profile", "default").trim();
    if (namespace.isEmpty() || !configuration.getKeys("llm.%s".formatted(namespace)).hasNext()) {
      throw new ConfigException("Missing llm.%s configuration".formatted(namespace));
    }
    return create(configuration.subset("llm.%s".formatted(namespace)));
  }

  /** Creates a client from a profile subset; {@code provider} selects the SPI implementation. */
  public static LlmClient create(Configuration subConfig) {
    String provider = subConfig.getString("provider");
    if (provider == null || provider.isBlank()) {
      throw new ConfigException("Missing llm.<profile>.provider");
    }
    provider = provider.trim().toLowerCase(Locale.ROOT);

    for (LlmClientProvider p : ServiceLoader.load(LlmClientProvider.class)) {
      if (provider.equals(p.providerId())) {
        return p.create(subConfig);
      }
    }
    throw new ConfigException("Unknown llm provider: " + provider);
  }
}
