package com.gentoro.kbgen.prompt;

import com.gentoro.kbgen.model.LlmClient;
import java.util.List;
import java.util.Map;

/**
 * Immutable definition of a prompt template composed of multiple sections. Use {@link
 * PromptSession} to select sections and render.
 */
public interface PromptTemplate {
  /** Identifier of this template (e.g., "world-stubs"). */
  String id();

  /** Read-only view of the sections defined by this template. */
  List<PromptSection> sections();

  /** Create a new mutable session to enable/disable sections and render. */
  PromptSession newSession();

  /** A single prompt section (message) definition. */
  record PromptSection(LlmClient.Role role, String id, boolean enabledByDefault, String content) {}

  /** Per-render mutable context used to enable/disable sections and render output. */
  interface PromptSession {
    PromptSession enable(String sectionId, Map<String, Object> vars);

    PromptSession disable(String... sectionIds);

    /** Apply the same variables to every section enabled by default. */
    PromptSession enableDefaults(Map<String, Object> vars);

    List<LlmClient.Message> renderMessages();
  }
}
