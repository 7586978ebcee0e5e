package com.gentoro.kbgen.render;

import com.gentoro.kbgen.exception.ValidationException;
import com.gentoro.kbgen.graph.Edge;
import com.gentoro.kbgen.graph.KnowledgeGraph;
import com.gentoro.kbgen.graph.Node;
import com.gentoro.kbgen.utility.StringUtility;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.configuration2.Configuration;

/**
 * Renders the bounded-radius neighborhood of a focal node into a closed set of linked documents.
 *
 * <p>Nodes are collected by undirected breadth-first search. The focal node is rendered first
 * under the key {@value DocumentSet#FOCAL_KEY}; the remaining nodes follow in {@code createdAt}
 * order and are keyed by {@code <type>/<name>} slugs with a numeric suffix on collision. Each
 * document lists the node's attributes and then its outgoing edges to other rendered nodes.
 */
public class NeighborhoodRenderer {
  private static final org.slf4j.Logger log =
      com.gentoro.kbgen.logging.LoggingService.getLogger(NeighborhoodRenderer.class);

  public static final int DEFAULT_RADIUS = 2;

  private final int defaultRadius;

  public NeighborhoodRenderer() {
    this(DEFAULT_RADIUS);
  }

  public NeighborhoodRenderer(int defaultRadius) {
    if (defaultRadius < 0) {
      throw new ValidationException("Render radius must be >= 0, got " + defaultRadius);
    }
    this.defaultRadius = defaultRadius;
  }

  public static NeighborhoodRenderer fromConfiguration(Configuration cfg) {
    return new NeighborhoodRenderer(cfg.getInt("render.radius", DEFAULT_RADIUS));
  }

  public int getDefaultRadius() {
    return defaultRadius;
  }

  public DocumentSet render(KnowledgeGraph graph, String focalNodeId) {
    return render(graph, focalNodeId, defaultRadius);
  }

  public DocumentSet render(KnowledgeGraph graph, String focalNodeId, int radius) {
    return render(graph, focalNodeId, radius, List.of());
  }

  /**
   * Render the neighborhood plus any {@code retainedNodeIds} that still exist in the graph, even
   * when they are no longer within {@code radius}.
   */
  public DocumentSet render(
      KnowledgeGraph graph, String focalNodeId, int radius, Collection<String> retainedNodeIds) {
    Set<String> included = new LinkedHashSet<>(graph.distancesFrom(focalNodeId, radius).keySet());
    for (String id : retainedNodeIds) {
      if (graph.containsNode(id)) included.add(id);
    }

    List<Node> ordered = new ArrayList<>();
    ordered.add(graph.node(focalNodeId));
    included.stream()
        .filter(id -> !id.equals(focalNodeId))
        .map(graph::node)
        .sorted(Comparator.comparingLong(Node::getCreatedAt).thenComparing(Node::getId))
        .forEach(ordered::add);

    Map<String, String> keys = assignKeys(ordered);
    List<Document> documents = new ArrayList<>();
    for (Node node : ordered) {
      documents.add(renderNode(graph, node, keys));
    }
    log.trace(
        "Rendered {} document(s) around node {} (radius {})",
        documents.size(),
        focalNodeId,
        radius);
    return DocumentSet.of(focalNodeId, radius, documents).checkClosure();
  }

  /** Section heading for a node type: {@code "restaurant"} becomes "Restaurant Information". */
  public static String informationSection(String type) {
    return StringUtility.humanize(type) + " Information";
  }

  private Map<String, String> assignKeys(List<Node> ordered) {
    Map<String, String> keys = new HashMap<>();
    Set<String> used = new HashSet<>();
    for (int i = 0; i < ordered.size(); i++) {
      Node node = ordered.get(i);
      String key;
      if (i == 0) {
        key = DocumentSet.FOCAL_KEY;
      } else {
        String base = StringUtility.slug(node.getType()) + "/" + StringUtility.slug(node.getName());
        key = base;
        for (int n = 2; used.contains(key); n++) {
          key = base + "_" + n;
        }
      }
      used.add(key);
      keys.put(node.getId(), key);
    }
    return keys;
  }

  private Document renderNode(KnowledgeGraph graph, Node node, Map<String, String> keys) {
    List<DocumentField> fields = new ArrayList<>();
    String section = informationSection(node.getType());
    node.getAttributes()
        .forEach(
            (name, value) -> {
              if (value != null) {
                fields.add(DocumentField.attribute(section, name, String.valueOf(value)));
              }
            });
    for (Edge edge : graph.outgoing(node.getId())) {
      String targetKey = keys.get(edge.target());
      if (targetKey == null) continue;
      fields.add(
          new DocumentField(
              Document.RELATIONSHIPS,
              edge.label(),
              graph.node(edge.target()).getName(),
              targetKey));
    }
    return new Document(keys.get(node.getId()), node.getId(), node.getName(), fields);
  }
}
