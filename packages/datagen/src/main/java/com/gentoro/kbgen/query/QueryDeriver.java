package com.gentoro.kbgen.query;

import com.gentoro.kbgen.exception.ValidationException;
import com.gentoro.kbgen.graph.Edge;
import com.gentoro.kbgen.graph.EdgeStep;
import com.gentoro.kbgen.graph.GraphPath;
import com.gentoro.kbgen.graph.KnowledgeGraph;
import com.gentoro.kbgen.graph.Node;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Enumerates the facts reachable within two hops of a focal node and samples them per hop.
 *
 * <ul>
 *   <li>0 hops: attributes of the focal node.
 *   <li>1 hop: identity and attributes of every node joined to the focal node by an edge, in
 *       either direction. Each edge yields its own path.
 *   <li>2 hops: identity and attributes of nodes reached through exactly one intermediate node
 *       and lying at shortest distance 2. Nodes that are also adjacent to the focal node are left
 *       to the 1-hop pass.
 * </ul>
 */
public class QueryDeriver {
  private static final org.slf4j.Logger log =
      com.gentoro.kbgen.logging.LoggingService.getLogger(QueryDeriver.class);

  public static final int MAX_HOPS = 2;

  /** Every fact ordered by hop, then by edge insertion order, then by attribute order. */
  public List<QueryFact> enumerate(KnowledgeGraph graph, String focalNodeId) {
    Map<String, Integer> distance = graph.distancesFrom(focalNodeId, MAX_HOPS);
    List<QueryFact> facts = new ArrayList<>();
    GraphPath origin = GraphPath.start(focalNodeId);

    addAttributeFacts(facts, 0, origin, graph.node(focalNodeId));

    for (Edge first : graph.incident(focalNodeId)) {
      GraphPath path = origin.then(EdgeStep.leaving(focalNodeId, first));
      if (!graph.containsNode(path.end())) continue;
      Node neighbor = graph.node(path.end());
      facts.add(new QueryFact(1, path, null, neighbor.getName()));
      addAttributeFacts(facts, 1, path, neighbor);
    }

    for (Edge first : graph.incident(focalNodeId)) {
      GraphPath viaPath = origin.then(EdgeStep.leaving(focalNodeId, first));
      String mid = viaPath.end();
      if (!graph.containsNode(mid)) continue;
      for (Edge second : graph.incident(mid)) {
        if (second.equals(first)) continue;
        GraphPath path = viaPath.then(EdgeStep.leaving(mid, second));
        Integer d = distance.get(path.end());
        if (d == null || d != 2) continue;
        Node end = graph.node(path.end());
        facts.add(new QueryFact(2, path, null, end.getName()));
        addAttributeFacts(facts, 2, path, end);
      }
    }
    return facts;
  }

  /**
   * Sample up to {@code countsPerHop.get(hop)} facts per hop. A hop missing from the map keeps all
   * of its facts. Sampling consumes {@code random} in hop order, so equal seeds give equal output.
   */
  public QueryDerivation derive(
      KnowledgeGraph graph, String focalNodeId, Map<Integer, Integer> countsPerHop, Random random) {
    countsPerHop.forEach(
        (hop, count) -> {
          if (count == null || count < 0) {
            throw new ValidationException(
                "Question count for hop %s must be >= 0, got %s".formatted(hop, count));
          }
        });

    List<QueryFact> all = enumerate(graph, focalNodeId);
    List<QueryFact> selected = new ArrayList<>();
    List<Shortfall> shortfalls = new ArrayList<>();
    for (int hop = 0; hop <= MAX_HOPS; hop++) {
      final int h = hop;
      List<QueryFact> atHop = all.stream().filter(f -> f.hopDistance() == h).toList();
      Integer requested = countsPerHop.get(hop);
      if (requested == null) {
        selected.addAll(atHop);
        continue;
      }
      if (atHop.size() < requested) {
        shortfalls.add(new Shortfall(hop, requested, atHop.size()));
        log.debug(
            "Node {} has {} fact(s) at hop {}, {} requested",
            focalNodeId,
            atHop.size(),
            hop,
            requested);
      }
      selected.addAll(sample(atHop, requested, random));
    }
    return new QueryDerivation(selected, shortfalls);
  }

  private static List<QueryFact> sample(List<QueryFact> facts, int count, Random random) {
    Map<QueryFact, Integer> order = new IdentityHashMap<>();
    for (int i = 0; i < facts.size(); i++) order.put(facts.get(i), i);
    List<QueryFact> shuffled = new ArrayList<>(facts);
    Collections.shuffle(shuffled, random);
    List<QueryFact> picked = new ArrayList<>(shuffled.subList(0, Math.min(count, shuffled.size())));
    picked.sort((a, b) -> Integer.compare(order.get(a), order.get(b)));
    return picked;
  }

  private static void addAttributeFacts(List<QueryFact> out, int hop, GraphPath path, Node node) {
    node.getAttributes()
        .forEach(
            (key, value) -> {
              if (value != null) {
                out.add(new QueryFact(hop, path, key, String.valueOf(value)));
              }
            });
  }
}
