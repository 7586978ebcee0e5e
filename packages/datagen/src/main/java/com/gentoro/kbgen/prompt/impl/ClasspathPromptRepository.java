package com.gentoro.kbgen.prompt.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.kbgen.exception.ExceptionUtil;
import com.gentoro.kbgen.exception.NotFoundException;
import com.gentoro.kbgen.exception.PromptException;
import com.gentoro.kbgen.exception.ValidationException;
import com.gentoro.kbgen.model.LlmClient;
import com.gentoro.kbgen.prompt.PromptRepository;
import com.gentoro.kbgen.prompt.PromptTemplate;
import com.gentoro.kbgen.utility.JacksonUtility;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads prompt YAML templates from the classpath starting at a base directory. Example basePath:
 * "prompts" (resolves resources like "prompts/questions.yaml"). Parsed templates are cached.
 */
public class ClasspathPromptRepository implements PromptRepository {
  private final String basePath;
  private final ClassLoader classLoader;
  private final Map<String, PromptTemplate> cache = new ConcurrentHashMap<>();

  public ClasspathPromptRepository(String basePath) {
    this(basePath, Thread.currentThread().getContextClassLoader());
  }

  public ClasspathPromptRepository(String basePath, ClassLoader classLoader) {
    this.basePath = normalize(Objects.requireNonNull(basePath, "basePath"));
    this.classLoader =
        Objects.requireNonNullElseGet(
            classLoader, () -> ClasspathPromptRepository.class.getClassLoader());
  }

  @Override
  public PromptTemplate get(String name) {
    String id = name.startsWith("/") ? name.substring(1) : name;
    return cache.computeIfAbsent(id, this::load);
  }

  private PromptTemplate load(String id) {
    try {
      String resource = resolveExisting(id);
      if (resource == null) {
        throw new NotFoundException("Prompt not found on classpath: " + id);
      }

      String yamlContent;
      try (InputStream is = classLoader.getResourceAsStream(resource)) {
        if (is == null) {
          throw new NotFoundException("Prompt resource not found: " + resource);
        }
        yamlContent = new String(is.readAllBytes(), StandardCharsets.UTF_8);
      }

      JsonNode root = JacksonUtility.getYamlMapper().readTree(yamlContent);
      JsonNode arr = root == null ? null : root.get("sections");
      if (arr == null || !arr.isArray()) {
        throw new ValidationException("Prompt YAML must contain a 'sections' array: " + id);
      }

      List<PromptTemplate.PromptSection> sections = new ArrayList<>();
      for (JsonNode n : arr) {
        String roleStr = n.path("role").asText(null);
        if (roleStr == null) {
          throw new ValidationException("Missing role for a section in prompt: " + id);
        }
        LlmClient.Role role =
            switch (roleStr.toLowerCase(Locale.ROOT)) {
              case "user" -> LlmClient.Role.USER;
              case "assistant" -> LlmClient.Role.ASSISTANT;
              case "system" -> LlmClient.Role.SYSTEM;
              default -> throw new ValidationException(
                  "Unknown role '" + roleStr + "' in prompt: " + id);
            };

        String sectionId = n.path("id").asText(null);
        if (sectionId == null || sectionId.isBlank()) {
          throw new ValidationException("Missing section id in prompt: " + id);
        }
        boolean enabled = n.path("enabled").asBoolean(true);
        String content = n.path("content").asText("");
        if (content.isBlank()) {
          throw new ValidationException(
              "Empty content for section '" + sectionId + "' in prompt: " + id);
        }
        sections.add(new PromptTemplate.PromptSection(role, sectionId, enabled, content));
      }
      return new PebblePromptTemplate(id, sections);
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, (ex) -> new PromptException("Failed to read prompt file: " + id, ex));
    }
  }

  private String resolveExisting(String id) {
    String yaml = basePath + "/" + id + ".yaml";
    if (classLoader.getResource(yaml) != null) return yaml;
    String yml = basePath + "/" + id + ".yml";
    if (classLoader.getResource(yml) != null) return yml;
    return null;
  }

  private static String normalize(String p) {
    String out = p.trim();
    if (out.startsWith("/")) out = out.substring(1);
    if (out.endsWith("/")) out = out.substring(0, out.length() - 1);
    return out;
  }
}
