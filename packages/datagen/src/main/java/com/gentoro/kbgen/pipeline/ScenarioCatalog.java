package com.gentoro.kbgen.pipeline;

import com.gentoro.kbgen.exception.ConfigException;
import com.gentoro.kbgen.exception.NotFoundException;
import com.gentoro.kbgen.render.NeighborhoodRenderer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.HierarchicalConfiguration;
import org.apache.commons.configuration2.ex.ConversionException;
import org.apache.commons.configuration2.tree.ImmutableNode;

/**
 * Scenarios declared under {@code scenarios} in the application configuration:
 *
 * <pre>
 * scenarios:
 *   - name: pangorio
 *     world-description: "An Italian-American family restaurant ..."
 *     num-people: 5
 *     num-entities: 5
 *     num-focal-nodes: 3
 *     questions-per-hop: { hop-0: 4, hop-1: 4, hop-2: 4 }
 *     updates-per-hop: { hop-0: 3, hop-1: 2, hop-2: 1 }
 *     clarifications-per-kind: 1
 *     seed: 7
 * </pre>
 *
 * A missing {@code updates-per-hop} block falls back to {@link
 * ScenarioConfig#DEFAULT_UPDATES_PER_HOP}.
 */
public class ScenarioCatalog {
  private static final org.slf4j.Logger log =
      com.gentoro.kbgen.logging.LoggingService.getLogger(ScenarioCatalog.class);

  private static final String HOP_PREFIX = "hop-";

  private final Map<String, ScenarioConfig> scenarios;

  public ScenarioCatalog(List<ScenarioConfig> scenarios) {
    Map<String, ScenarioConfig> byName = new LinkedHashMap<>();
    for (ScenarioConfig s : scenarios) {
      if (byName.putIfAbsent(s.name(), s) != null) {
        throw new ConfigException("Duplicate scenario name: " + s.name());
      }
    }
    this.scenarios = byName;
  }

  public static ScenarioCatalog fromConfiguration(Configuration cfg) {
    if (!(cfg instanceof HierarchicalConfiguration<?>)) {
      throw new ConfigException(
          "Scenario definitions need a hierarchical configuration, got "
              + cfg.getClass().getSimpleName());
    }
    @SuppressWarnings("unchecked")
    HierarchicalConfiguration<ImmutableNode> root = (HierarchicalConfiguration<ImmutableNode>) cfg;
    int defaultRadius = cfg.getInt("render.radius", NeighborhoodRenderer.DEFAULT_RADIUS);

    List<ScenarioConfig> out = new ArrayList<>();
    for (HierarchicalConfiguration<ImmutableNode> sc : root.configurationsAt("scenarios")) {
      out.add(toScenario(sc, defaultRadius));
    }
    log.debug("Loaded {} scenario(s) from configuration", out.size());
    return new ScenarioCatalog(out);
  }

  static ScenarioConfig toScenario(Configuration sc, int defaultRadius) {
    String name = sc.getString("name");
    String world = sc.getString("world-description");
    if (world == null || world.isBlank()) {
      throw new ConfigException("Scenario %s has no world-description".formatted(name));
    }
    try {
      return new ScenarioConfig(
          name,
          world.trim(),
          sc.getInt("num-people", 5),
          sc.getInt("num-entities", 5),
          sc.getInt("num-focal-nodes", 3),
          perHop(sc, "questions-per-hop", Map.of()),
          perHop(sc, "updates-per-hop", ScenarioConfig.DEFAULT_UPDATES_PER_HOP),
          sc.getInt("clarifications-per-kind", 1),
          sc.getInt("radius", defaultRadius),
          sc.getLong("seed", 42L));
    } catch (ConversionException e) {
      throw new ConfigException("Invalid value in scenario " + name, e);
    }
  }

  private static Map<Integer, Integer> perHop(
      Configuration sc, String block, Map<Integer, Integer> fallback) {
    Configuration hops = sc.subset(block);
    if (hops.isEmpty()) return fallback;
    Map<Integer, Integer> out = new HashMap<>();
    Iterator<String> keys = hops.getKeys();
    while (keys.hasNext()) {
      String key = keys.next();
      if (!key.startsWith(HOP_PREFIX)) {
        throw new ConfigException("Unknown %s key: %s".formatted(block, key));
      }
      int hop;
      try {
        hop = Integer.parseInt(key.substring(HOP_PREFIX.length()));
      } catch (NumberFormatException e) {
        throw new ConfigException("Unknown %s key: %s".formatted(block, key), e);
      }
      out.put(hop, hops.getInt(key));
    }
    return out;
  }

  public List<ScenarioConfig> all() {
    return List.copyOf(scenarios.values());
  }

  public List<String> names() {
    return List.copyOf(scenarios.keySet());
  }

  public ScenarioConfig get(String name) {
    ScenarioConfig s = scenarios.get(name);
    if (s == null) {
      throw new NotFoundException("Unknown scenario: " + name + " (known: " + names() + ")");
    }
    return s;
  }

  public boolean isEmpty() {
    return scenarios.isEmpty();
  }
}
