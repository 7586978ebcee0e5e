package com.gentoro.kbgen.prompt.impl;

import com.gentoro.kbgen.exception.PromptException;
import com.gentoro.kbgen.model.LlmClient;
import com.gentoro.kbgen.prompt.PromptTemplate;
import io.pebbletemplates.pebble.PebbleEngine;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pebble-based implementation of an immutable PromptTemplate definition. Rendering state is
 * isolated in PromptSession instances. Output is not HTML-escaped since it goes to a model.
 */
public class PebblePromptTemplate implements PromptTemplate {
  private static final PebbleEngine ENGINE =
      new PebbleEngine.Builder().strictVariables(true).autoEscaping(false).build();

  private final String id;
  private final List<PromptSection> sections;
  private final List<CompiledSection> compiled;

  private record CompiledSection(PromptSection section, PebbleTemplate template) {}

  public PebblePromptTemplate(String id, List<PromptSection> sections) {
    this.id = Objects.requireNonNull(id, "id");
    this.sections = List.copyOf(Objects.requireNonNull(sections, "sections"));
    this.compiled =
        this.sections.stream()
            .map(s -> new CompiledSection(s, ENGINE.getLiteralTemplate(s.content())))
            .toList();
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public List<PromptSection> sections() {
    return sections;
  }

  @Override
  public PromptSession newSession() {
    return new Session();
  }

  private class Session implements PromptSession {
    private final Map<String, Map<String, Object>> enabled = new LinkedHashMap<>();

    @Override
    public PromptSession enable(String sectionId, Map<String, Object> vars) {
      enabled.put(sectionId, vars != null ? new HashMap<>(vars) : new HashMap<>());
      return this;
    }

    @Override
    public PromptSession disable(String... sectionIds) {
      if (sectionIds != null) {
        for (String sid : sectionIds) {
          enabled.remove(sid);
        }
      }
      return this;
    }

    @Override
    public PromptSession enableDefaults(Map<String, Object> vars) {
      for (PromptSection s : sections) {
        if (s.enabledByDefault()) enable(s.id(), vars);
      }
      return this;
    }

    @Override
    public List<LlmClient.Message> renderMessages() {
      List<LlmClient.Message> out = new ArrayList<>();
      for (CompiledSection cs : compiled) {
        PromptSection s = cs.section();
        if (!enabled.containsKey(s.id())) continue;
        try {
          Writer writer = new StringWriter();
          cs.template().evaluate(writer, enabled.get(s.id()));
          out.add(new LlmClient.Message(s.role(), writer.toString().trim()));
        } catch (Exception e) {
          throw new PromptException(
              "Failed to render prompt section '" + s.id() + "' in template '" + id + "'", e);
        }
      }
      return out;
    }
  }
}
