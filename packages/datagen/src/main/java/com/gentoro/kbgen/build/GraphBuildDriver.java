package com.gentoro.kbgen.build;

import com.gentoro.kbgen.exception.ExceptionUtil;
import com.gentoro.kbgen.exception.GenerationException;
import com.gentoro.kbgen.exception.ValidationException;
import com.gentoro.kbgen.generation.TextGenerationService;
import com.gentoro.kbgen.graph.Edge;
import com.gentoro.kbgen.graph.KnowledgeGraph;
import com.gentoro.kbgen.graph.Node;
import com.gentoro.kbgen.messages.AttributeList;
import com.gentoro.kbgen.messages.AttributePair;
import com.gentoro.kbgen.messages.EdgePlan;
import com.gentoro.kbgen.messages.EntityStub;
import com.gentoro.kbgen.messages.PersonStub;
import com.gentoro.kbgen.messages.PlannedEdge;
import com.gentoro.kbgen.messages.WorldStubs;
import com.gentoro.kbgen.pipeline.progress.ProgressSink;
import com.gentoro.kbgen.utility.JacksonUtility;
import com.gentoro.kbgen.utility.StringUtility;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a knowledge graph for a world description in three generation phases:
 *
 * <ol>
 *   <li>stubs: people and entities with ids and names;
 *   <li>edges: relationships between the stubs;
 *   <li>enrichment: attributes for every node, given its current neighborhood.
 * </ol>
 *
 * The driver is lenient with model output: duplicate stubs, self-loops, duplicate edges and edges
 * referring to unknown nodes are dropped with a warning. Structural problems that remain are left
 * for the validator to report.
 */
public class GraphBuildDriver {
  private static final org.slf4j.Logger log =
      com.gentoro.kbgen.logging.LoggingService.getLogger(GraphBuildDriver.class);

  public static final String STUBS_PROMPT = "world-stubs";
  public static final String EDGES_PROMPT = "edge-plan";
  public static final String ENRICH_PROMPT = "enrich-node";

  private static final Set<String> RESERVED_ATTRIBUTES = Set.of("id", "name", "type");

  private final TextGenerationService generation;
  private final ProgressSink progress;

  public GraphBuildDriver(TextGenerationService generation, ProgressSink progress) {
    this.generation = generation;
    this.progress = progress;
  }

  public KnowledgeGraph build(String worldDescription, int numPeople, int numEntities) {
    if (numPeople < 1 || numEntities < 0) {
      throw new ValidationException(
          "Need at least one person and a non-negative entity count, got %d/%d"
              .formatted(numPeople, numEntities));
    }
    KnowledgeGraph graph = new KnowledgeGraph();
    progress.beginStage("build", "Building knowledge graph", 3);
    try {
      generateStubs(graph, worldDescription, numPeople, numEntities);
      progress.step("build", 1, "stubs", Map.of("nodes", graph.nodeCount()));
      planEdges(graph, worldDescription);
      progress.step("build", 2, "edges", Map.of("edges", graph.edgeCount()));
      enrich(graph, worldDescription);
      progress.endStageOk("build", Map.of("nodes", graph.nodeCount(), "edges", graph.edgeCount()));
      return graph;
    } catch (RuntimeException e) {
      progress.endStageError("build", ExceptionUtil.summarize(e), Map.of());
      throw e;
    }
  }

  void generateStubs(KnowledgeGraph graph, String world, int numPeople, int numEntities) {
    WorldStubs stubs =
        generation.generate(
            STUBS_PROMPT,
            Map.of("world", world, "numPeople", numPeople, "numEntities", numEntities),
            WorldStubs.class);
    for (PersonStub p : stubs.people()) {
      addStub(graph, p.id(), Node.PERSON, p.name());
    }
    if (stubs.entities() != null) {
      for (EntityStub e : stubs.entities()) {
        addStub(graph, e.id(), entityType(e.entityType()), e.name());
      }
    }
    log.info(
        "Generated {} person and {} entity stub(s)",
        graph.persons().size(),
        graph.nodeCount() - graph.persons().size());
  }

  void planEdges(KnowledgeGraph graph, String world) {
    List<Map<String, String>> nodes = new ArrayList<>();
    for (Node n : graph.nodes()) {
      Map<String, String> m = new LinkedHashMap<>();
      m.put("id", n.getId());
      m.put("name", n.getName());
      m.put("type", n.getType());
      nodes.add(m);
    }
    EdgePlan plan =
        generation.generate(
            EDGES_PROMPT,
            Map.of("world", world, "nodes", JacksonUtility.toJson(nodes)),
            EdgePlan.class);

    for (PlannedEdge e : plan.edges()) {
      Optional<String> source = resolve(graph, e.subjectId());
      Optional<String> target = resolve(graph, e.objectId());
      if (source.isEmpty() || target.isEmpty()) {
        log.warn("Skipping edge with unknown endpoint: {}", e);
        continue;
      }
      try {
        graph.addEdge(source.get(), e.predicate(), target.get());
      } catch (ValidationException ex) {
        log.warn("Skipping edge {}: {}", e, ex.getMessage());
      }
    }
  }

  void enrich(KnowledgeGraph graph, String world) {
    List<String> ids = graph.nodes().stream().map(Node::getId).toList();
    for (String id : ids) {
      AttributeList attributes;
      try {
        attributes =
            generation.generate(
                ENRICH_PROMPT,
                Map.of("world", world, "node", describeNode(graph, id)),
                AttributeList.class);
      } catch (GenerationException e) {
        log.warn("Could not enrich node {}: {}", id, e.getMessage());
        continue;
      }
      for (AttributePair pair : attributes.attributes()) {
        String key = StringUtility.slug(pair.key());
        if (RESERVED_ATTRIBUTES.contains(key)) continue;
        graph.setAttribute(id, key, scalar(pair.value()));
      }
    }
  }

  /** Human readable summary of a node, its attributes and its relationships. */
  public static String describeNode(KnowledgeGraph graph, String nodeId) {
    Node node = graph.node(nodeId);
    StringBuilder sb = new StringBuilder();
    sb.append("NODE: ")
        .append(node.getName())
        .append(" (ID: ")
        .append(nodeId)
        .append(", Type: ")
        .append(node.getType())
        .append(")\n");
    sb.append("ATTRIBUTES:\n");
    node.getAttributes()
        .forEach((k, v) -> sb.append("  - ").append(k).append(": ").append(v).append('\n'));
    sb.append("RELATIONS:\n");
    for (Edge e : graph.incident(nodeId)) {
      String source = graph.findNode(e.source()).map(Node::getName).orElse(e.source());
      String target = graph.findNode(e.target()).map(Node::getName).orElse(e.target());
      sb.append("  ")
          .append(source)
          .append(" --[")
          .append(e.label())
          .append("]--> ")
          .append(target)
          .append('\n');
    }
    return sb.toString();
  }

  private static void addStub(KnowledgeGraph graph, String id, String type, String name) {
    if (graph.containsNode(id)) {
      log.warn("Skipping stub with duplicate id {} ({})", id, name);
      return;
    }
    graph.addNode(id, type, name.trim(), Map.of());
  }

  private static String entityType(String raw) {
    if (raw == null || raw.isBlank()) return "entity";
    String type = StringUtility.slug(raw);
    return Node.PERSON.equals(type) ? "entity" : type;
  }

  /** Stub ids first, then exact names, the way models tend to mix them up. */
  private static Optional<String> resolve(KnowledgeGraph graph, String ref) {
    if (ref == null) return Optional.empty();
    String trimmed = ref.trim();
    if (graph.containsNode(trimmed)) return Optional.of(trimmed);
    return graph.nodes().stream()
        .filter(n -> n.getName().equals(trimmed))
        .map(Node::getId)
        .findFirst();
  }

  private static Object scalar(Object value) {
    if (value instanceof String || value instanceof Boolean) return value;
    if (value instanceof Integer || value instanceof Long || value instanceof Double) return value;
    if (value instanceof Number n) return n.doubleValue();
    return value == null ? null : JacksonUtility.toCompactJson(value);
  }
}
