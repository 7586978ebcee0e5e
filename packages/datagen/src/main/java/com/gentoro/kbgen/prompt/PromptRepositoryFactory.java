package com.gentoro.kbgen.prompt;

import com.gentoro.kbgen.exception.ConfigException;
import com.gentoro.kbgen.prompt.impl.ClasspathPromptRepository;
import org.apache.commons.configuration2.Configuration;

public class PromptRepositoryFactory {

  /**
   * Create a PromptRepository from the {@code prompt} configuration subset. Supported property:
   * {@code location}, for instance {@code classpath:prompts}.
   */
  public static PromptRepository create(Configuration promptCfg) {
    if (promptCfg == null) {
      throw new ConfigException("Prompt configuration not provided");
    }

    String location = promptCfg.getString("location", "classpath:prompts").trim();
    if (!location.startsWith("classpath:")) {
      throw new ConfigException(
          "Unsupported prompt.location (expected classpath:...): " + location);
    }
    String base = location.substring("classpath:".length());
    if (base.startsWith("/")) base = base.substring(1);
    if (base.isBlank()) {
      throw new ConfigException("Invalid prompt.location: base path is empty");
    }
    return new ClasspathPromptRepository(base);
  }
}
