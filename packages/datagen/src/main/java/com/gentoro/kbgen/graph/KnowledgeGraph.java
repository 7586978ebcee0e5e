package com.gentoro.kbgen.graph;

import com.gentoro.kbgen.exception.NotFoundException;
import com.gentoro.kbgen.exception.StateException;
import com.gentoro.kbgen.exception.ValidationException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Typed node/edge container backing a generated world.
 *
 * <p>The container is intentionally permissive about node ids and edge endpoints: it keeps
 * colliding ids and edges whose endpoints do not exist so that {@code GraphValidator} can report
 * them. It does reject self-loops and duplicate {@code (source, label, target)} triples.
 *
 * <p>Traversal helpers ({@link #neighbors}, {@link #distancesFrom}, {@link #shortestPath}) treat
 * edges as undirected and iterate them in insertion order, which keeps every derived artifact
 * deterministic.
 *
 * <p>Once {@link #freeze() frozen} the graph rejects all mutation and may be shared between
 * threads; writers work on a {@link #copy()}.
 */
public class KnowledgeGraph {
  private final List<Node> nodes = new ArrayList<>();
  private final Map<String, Integer> positions = new HashMap<>();
  private final List<Edge> edges = new ArrayList<>();
  private final Set<Edge> edgeSet = new HashSet<>();
  private final Map<String, List<Integer>> incidence = new HashMap<>();
  private long nextOrdinal;
  private volatile boolean frozen;

  /** Add a node; its {@code createdAt} ordinal is the next insertion sequence number. */
  public Node addNode(String id, String type, String name, Map<String, ?> attributes) {
    return addNode(new Node(id, type, name, attributes, nextOrdinal));
  }

  /** Add a node keeping its own {@code createdAt}; used when restoring or copying graphs. */
  public Node addNode(Node node) {
    checkMutable();
    nodes.add(node);
    positions.putIfAbsent(node.getId(), nodes.size() - 1);
    nextOrdinal = Math.max(nextOrdinal, node.getCreatedAt() + 1);
    return node;
  }

  public Edge addEdge(String source, String label, String target) {
    checkMutable();
    Edge edge = new Edge(source, label, target);
    if (edge.source().equals(edge.target())) {
      throw new ValidationException("Self-loops are not allowed: " + edge);
    }
    if (!edgeSet.add(edge)) {
      throw new ValidationException("Duplicate edge: " + edge);
    }
    edges.add(edge);
    int idx = edges.size() - 1;
    incidence.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(idx);
    incidence.computeIfAbsent(edge.target(), k -> new ArrayList<>()).add(idx);
    return edge;
  }

  /** Add or replace one attribute, keeping the attribute's original position when it exists. */
  public Node setAttribute(String nodeId, String key, Object value) {
    checkMutable();
    if (key == null || key.isBlank()) {
      throw new ValidationException("Attribute key cannot be null or empty");
    }
    int pos = position(nodeId);
    Node updated = nodes.get(pos).withAttribute(key, value);
    nodes.set(pos, updated);
    return updated;
  }

  /**
   * Point an existing edge at a different target. The edge keeps its position in the edge list so
   * that renderings of the source node keep their field order.
   */
  public Edge replaceEdgeTarget(Edge edge, String newTarget) {
    checkMutable();
    int idx = edges.indexOf(edge);
    if (idx < 0) {
      throw new NotFoundException("Edge not found: " + edge);
    }
    Edge replacement = edge.withTarget(newTarget);
    if (replacement.source().equals(replacement.target())) {
      throw new ValidationException("Self-loops are not allowed: " + replacement);
    }
    if (edgeSet.contains(replacement)) {
      throw new ValidationException("Duplicate edge: " + replacement);
    }
    edgeSet.remove(edge);
    edgeSet.add(replacement);
    edges.set(idx, replacement);
    incidence.get(edge.target()).remove(Integer.valueOf(idx));
    List<Integer> targetIncidence =
        incidence.computeIfAbsent(replacement.target(), k -> new ArrayList<>());
    targetIncidence.add(idx);
    Collections.sort(targetIncidence);
    return replacement;
  }

  public Node node(String id) {
    return nodes.get(position(id));
  }

  public Optional<Node> findNode(String id) {
    Integer pos = positions.get(id);
    return pos == null ? Optional.empty() : Optional.of(nodes.get(pos));
  }

  public boolean containsNode(String id) {
    return positions.containsKey(id);
  }

  /** All nodes in insertion order, including any that share an id. */
  public List<Node> nodes() {
    return Collections.unmodifiableList(nodes);
  }

  public List<Edge> edges() {
    return Collections.unmodifiableList(edges);
  }

  public List<Node> persons() {
    return nodes.stream().filter(Node::isPerson).toList();
  }

  /** Edges touching {@code nodeId} in either direction, in edge insertion order. */
  public List<Edge> incident(String nodeId) {
    List<Integer> idx = incidence.get(nodeId);
    if (idx == null) return List.of();
    return idx.stream().map(edges::get).toList();
  }

  public List<Edge> outgoing(String nodeId) {
    return incident(nodeId).stream().filter(e -> e.source().equals(nodeId)).toList();
  }

  public List<Edge> incoming(String nodeId) {
    return incident(nodeId).stream().filter(e -> e.target().equals(nodeId)).toList();
  }

  /** Distinct existing nodes adjacent to {@code nodeId}, ignoring edge direction. */
  public List<String> neighbors(String nodeId) {
    Set<String> out = new LinkedHashSet<>();
    for (Edge e : incident(nodeId)) {
      String other = e.other(nodeId);
      if (containsNode(other)) out.add(other);
    }
    return List.copyOf(out);
  }

  /**
   * Breadth-first hop distances from {@code startId}, bounded by {@code maxHops}. The map iterates
   * in discovery order and always contains {@code startId} at distance 0.
   */
  public LinkedHashMap<String, Integer> distancesFrom(String startId, int maxHops) {
    position(startId);
    if (maxHops < 0) {
      throw new ValidationException("maxHops must be >= 0, got " + maxHops);
    }
    LinkedHashMap<String, Integer> dist = new LinkedHashMap<>();
    Deque<String> queue = new ArrayDeque<>();
    dist.put(startId, 0);
    queue.add(startId);
    while (!queue.isEmpty()) {
      String current = queue.poll();
      int d = dist.get(current);
      if (d == maxHops) continue;
      for (String next : neighbors(current)) {
        if (!dist.containsKey(next)) {
          dist.put(next, d + 1);
          queue.add(next);
        }
      }
    }
    return dist;
  }

  /** Shortest undirected walk between two nodes; ties resolve to the earliest inserted edges. */
  public Optional<GraphPath> shortestPath(String fromId, String toId) {
    position(fromId);
    position(toId);
    Map<String, EdgeStep> parent = new HashMap<>();
    Set<String> seen = new HashSet<>();
    Deque<String> queue = new ArrayDeque<>();
    seen.add(fromId);
    queue.add(fromId);
    while (!queue.isEmpty() && !seen.contains(toId)) {
      String current = queue.poll();
      for (Edge e : incident(current)) {
        String next = e.other(current);
        if (!containsNode(next) || !seen.add(next)) continue;
        parent.put(next, EdgeStep.leaving(current, e));
        queue.add(next);
      }
    }
    if (!seen.contains(toId)) return Optional.empty();

    List<EdgeStep> reversed = new ArrayList<>();
    for (String at = toId; !at.equals(fromId); at = parent.get(at).from()) {
      reversed.add(parent.get(at));
    }
    GraphPath path = GraphPath.start(fromId);
    for (int i = reversed.size() - 1; i >= 0; i--) {
      path = path.then(reversed.get(i));
    }
    return Optional.of(path);
  }

  /** Deep, unfrozen copy; node ordinals and edge order are preserved. */
  public KnowledgeGraph copy() {
    KnowledgeGraph copy = new KnowledgeGraph();
    nodes.forEach(copy::addNode);
    for (Edge e : edges) {
      copy.addEdge(e.source(), e.label(), e.target());
    }
    copy.nextOrdinal = nextOrdinal;
    return copy;
  }

  /** Make the graph read-only. Returns {@code this} for chaining. */
  public KnowledgeGraph freeze() {
    this.frozen = true;
    return this;
  }

  public boolean isFrozen() {
    return frozen;
  }

  public int nodeCount() {
    return nodes.size();
  }

  public int edgeCount() {
    return edges.size();
  }

  private int position(String nodeId) {
    Integer pos = positions.get(nodeId);
    if (pos == null) {
      throw new NotFoundException("Node not found: " + nodeId);
    }
    return pos;
  }

  private void checkMutable() {
    if (frozen) {
      throw new StateException("Knowledge graph is frozen; mutate a copy instead");
    }
  }
}
