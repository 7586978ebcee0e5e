package com.gentoro.kbgen.pipeline;

import com.gentoro.kbgen.exception.ValidationException;
import java.util.Map;

/**
 * One dataset scenario.
 *
 * @param name scenario name, also the output sub-directory
 * @param worldDescription free-text world the graph is generated for
 * @param numPeople person nodes to generate
 * @param numEntities non-person nodes to generate
 * @param numFocalNodes persons sampled as focal nodes
 * @param questionsPerHop questions sampled per hop distance; a missing hop keeps every fact
 * @param updatesPerHop update scenarios simulated per focal node, keyed by the hop distance of the
 *     changed node
 * @param clarificationsPerKind clarification samples generated per focal node and kind
 * @param radius rendering radius around each focal node
 * @param seed seed for focal node sampling and per-node randomness
 */
public record ScenarioConfig(
    String name,
    String worldDescription,
    int numPeople,
    int numEntities,
    int numFocalNodes,
    Map<Integer, Integer> questionsPerHop,
    Map<Integer, Integer> updatesPerHop,
    int clarificationsPerKind,
    int radius,
    long seed) {
  /** Three own-fact edits, two one hop away and one two hops away. */
  public static final Map<Integer, Integer> DEFAULT_UPDATES_PER_HOP = Map.of(0, 3, 1, 2, 2, 1);

  public ScenarioConfig {
    if (name == null || name.isBlank()) {
      throw new ValidationException("Scenario name cannot be null or empty");
    }
    if (numPeople < 1) {
      throw new ValidationException("Scenario %s: num-people must be >= 1".formatted(name));
    }
    if (numEntities < 0) {
      throw new ValidationException("Scenario %s: num-entities must be >= 0".formatted(name));
    }
    if (numFocalNodes < 0) {
      throw new ValidationException("Scenario %s: num-focal-nodes must be >= 0".formatted(name));
    }
    if (clarificationsPerKind < 0) {
      throw new ValidationException(
          "Scenario %s: clarifications-per-kind must be >= 0".formatted(name));
    }
    if (radius < 0) {
      throw new ValidationException("Scenario %s: radius must be >= 0".formatted(name));
    }
    questionsPerHop = questionsPerHop == null ? Map.of() : Map.copyOf(questionsPerHop);
    updatesPerHop = updatesPerHop == null ? Map.of() : Map.copyOf(updatesPerHop);
    updatesPerHop.forEach(
        (hop, count) -> {
          if (hop < 0 || count < 0) {
            throw new ValidationException(
                "Scenario %s: updates-per-hop needs hop >= 0 and count >= 0, got hop-%d: %d"
                    .formatted(name, hop, count));
          }
        });
  }
}
