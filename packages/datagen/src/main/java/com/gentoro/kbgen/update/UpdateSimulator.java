package com.gentoro.kbgen.update;

import com.gentoro.kbgen.diff.DocumentDelta;
import com.gentoro.kbgen.diff.DocumentDiff;
import com.gentoro.kbgen.diff.DocumentDiffer;
import com.gentoro.kbgen.diff.FieldChange;
import com.gentoro.kbgen.exception.MutationExhaustedException;
import com.gentoro.kbgen.exception.NoMutableFactException;
import com.gentoro.kbgen.exception.StateException;
import com.gentoro.kbgen.exception.ValidationException;
import com.gentoro.kbgen.graph.Edge;
import com.gentoro.kbgen.graph.GraphPath;
import com.gentoro.kbgen.graph.KnowledgeGraph;
import com.gentoro.kbgen.graph.Node;
import com.gentoro.kbgen.render.Document;
import com.gentoro.kbgen.render.DocumentSet;
import com.gentoro.kbgen.render.NeighborhoodRenderer;
import com.gentoro.kbgen.validation.GraphValidator;
import com.gentoro.kbgen.validation.ValidationResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import org.apache.commons.configuration2.Configuration;

/**
 * Simulates a single-fact edit of a focal node's neighborhood.
 *
 * <p>The caller's graph is never touched: each attempt mutates a fresh {@link
 * KnowledgeGraph#copy()}. A mutation is rejected when it is a no-op or leaves the copy invalid;
 * the simulator then moves on to the next candidate fact, up to {@code maxAttempts}. An accepted
 * mutation is re-rendered with every previously rendered node retained, diffed against the
 * original documents and checked for locality before it is returned.
 */
public class UpdateSimulator {
  private static final org.slf4j.Logger log =
      com.gentoro.kbgen.logging.LoggingService.getLogger(UpdateSimulator.class);

  public static final List<String> DEFAULT_PROTECTED_ATTRIBUTES =
      List.of(
          "id",
          "full_name",
          "entity_type",
          "birth_date",
          "death_date",
          "birth_place",
          "death_place");
  public static final int DEFAULT_MAX_ATTEMPTS = 5;

  private final NeighborhoodRenderer renderer;
  private final GraphValidator validator;
  private final DocumentDiffer differ;
  private final ReplacementSource replacements;
  private final int maxAttempts;
  private final Set<String> protectedAttributes;

  public UpdateSimulator(
      NeighborhoodRenderer renderer,
      GraphValidator validator,
      DocumentDiffer differ,
      ReplacementSource replacements,
      int maxAttempts,
      Set<String> protectedAttributes) {
    if (maxAttempts < 1) {
      throw new ValidationException("maxAttempts must be >= 1, got " + maxAttempts);
    }
    this.renderer = renderer;
    this.validator = validator;
    this.differ = differ;
    this.replacements = replacements;
    this.maxAttempts = maxAttempts;
    this.protectedAttributes = Set.copyOf(protectedAttributes);
  }

  public static UpdateSimulator fromConfiguration(
      Configuration cfg,
      NeighborhoodRenderer renderer,
      GraphValidator validator,
      DocumentDiffer differ,
      ReplacementSource replacements) {
    List<String> protectedKeys = cfg.getList(String.class, "update.protected-attributes", null);
    return new UpdateSimulator(
        renderer,
        validator,
        differ,
        replacements,
        cfg.getInt("update.max-attempts", DEFAULT_MAX_ATTEMPTS),
        new HashSet<>(protectedKeys == null ? DEFAULT_PROTECTED_ATTRIBUTES : protectedKeys));
  }

  /**
   * Facts of the rendered neighborhood that may be edited, in document order: each node's
   * unprotected attributes, then its outgoing edges whose target is rendered too. Names are never
   * candidates.
   */
  public List<MutableFact> candidates(KnowledgeGraph graph, DocumentSet documents) {
    Set<String> rendered = new HashSet<>(documents.nodeIds());
    List<MutableFact> out = new ArrayList<>();
    for (Document doc : documents.documents().values()) {
      Node node = graph.node(doc.nodeId());
      node.getAttributes()
          .forEach(
              (key, value) -> {
                if (value != null && !protectedAttributes.contains(key)) {
                  out.add(MutableFact.attribute(node.getId(), key, value));
                }
              });
      for (Edge e : graph.outgoing(node.getId())) {
        if (rendered.contains(e.target())) out.add(MutableFact.relationship(e));
      }
    }
    return out;
  }

  /** Candidates whose node lies exactly {@code hop} hops from the focal node. */
  public List<MutableFact> candidatesAtHop(KnowledgeGraph graph, DocumentSet documents, int hop) {
    if (hop < 0) {
      throw new ValidationException("hop must be >= 0, got " + hop);
    }
    Map<String, Integer> distance = graph.distancesFrom(documents.focalNodeId(), hop);
    return candidates(graph, documents).stream()
        .filter(f -> Integer.valueOf(hop).equals(distance.get(f.nodeId())))
        .toList();
  }

  /** Simulate an edit of any candidate fact of the neighborhood. */
  public UpdateScenario simulate(
      KnowledgeGraph graph, DocumentSet documents, String focalNodeId, Random random) {
    List<MutableFact> candidates = candidates(graph, documents);
    if (candidates.isEmpty()) {
      throw new NoMutableFactException(focalNodeId);
    }
    return simulate(graph, documents, focalNodeId, candidates, random);
  }

  /** Simulate an edit of a fact held by a node exactly {@code hop} hops from the focal node. */
  public UpdateScenario simulate(
      KnowledgeGraph graph, DocumentSet documents, String focalNodeId, int hop, Random random) {
    List<MutableFact> candidates = candidatesAtHop(graph, documents, hop);
    if (candidates.isEmpty()) {
      throw new NoMutableFactException(focalNodeId, hop);
    }
    return simulate(graph, documents, focalNodeId, candidates, random);
  }

  private UpdateScenario simulate(
      KnowledgeGraph graph,
      DocumentSet documents,
      String focalNodeId,
      List<MutableFact> facts,
      Random random) {
    List<MutableFact> candidates = new ArrayList<>(facts);
    Collections.shuffle(candidates, random);

    List<String> rejections = new ArrayList<>();
    int attempts = Math.min(maxAttempts, candidates.size());
    for (int i = 0; i < attempts; i++) {
      MutableFact fact = candidates.get(i);
      Replacement replacement = replacements.propose(graph, focalNodeId, fact, random);
      if (replacement.newValue() == null) {
        rejections.add(fact + ": no replacement value proposed");
        continue;
      }
      KnowledgeGraph clone = graph.copy();
      String placeholderId = null;
      String oldValue;
      String newValue;
      try {
        if (fact.kind() == UpdateKind.ATTRIBUTE) {
          Object coerced = coerce(fact.currentValue(), replacement.newValue());
          oldValue = String.valueOf(fact.currentValue());
          newValue = String.valueOf(coerced);
          if (oldValue.equals(newValue)) {
            rejections.add(fact + ": replacement equals the current value");
            continue;
          }
          clone.setAttribute(fact.nodeId(), fact.attribute(), coerced);
        } else {
          Node oldTarget = graph.node(fact.edge().target());
          oldValue = oldTarget.getName();
          newValue = String.valueOf(replacement.newValue()).trim();
          if (newValue.isEmpty() || newValue.equals(oldValue)) {
            rejections.add(fact + ": replacement target equals the current one");
            continue;
          }
          placeholderId = new UUID(random.nextLong(), random.nextLong()).toString();
          clone.addNode(placeholderId, oldTarget.getType(), newValue, Map.of());
          clone.replaceEdgeTarget(fact.edge(), placeholderId);
        }
      } catch (ValidationException e) {
        rejections.add(fact + ": " + e.getMessage());
        continue;
      }

      ValidationResult validation = validator.validate(clone);
      if (!validation.ok()) {
        rejections.add(fact + ": " + validation.violations());
        log.debug("Rejected mutation of {}: {}", fact, validation.violations());
        continue;
      }

      Set<String> retained = new LinkedHashSet<>(documents.nodeIds());
      if (placeholderId != null) retained.add(placeholderId);
      DocumentSet updated = renderer.render(clone, focalNodeId, documents.radius(), retained);
      DocumentDiff diff = differ.diff(documents, updated);
      String changedKey = checkLocality(fact, documents, updated, diff, placeholderId);
      GraphPath path = pathTo(graph, focalNodeId, fact);

      return new UpdateScenario(
          focalNodeId,
          fact.kind(),
          path.length(),
          fact.nodeId(),
          changedKey,
          fact.field(),
          placeholderId,
          describePath(graph, path, fact, oldValue),
          describePath(graph, path, fact, newValue),
          oldValue,
          newValue,
          replacement.utterances(),
          diff,
          updated);
    }
    throw new MutationExhaustedException(focalNodeId, rejections);
  }

  /**
   * The diff may touch only the changed node's document, by exactly one changed field, plus the
   * document of a new relationship target.
   */
  private String checkLocality(
      MutableFact fact,
      DocumentSet before,
      DocumentSet after,
      DocumentDiff diff,
      String placeholderId) {
    String changedKey =
        before
            .forNode(fact.nodeId())
            .map(Document::key)
            .orElseThrow(() -> new StateException("Changed node is not rendered: " + fact));
    String placeholderKey =
        placeholderId == null
            ? null
            : after
                .forNode(placeholderId)
                .map(Document::key)
                .orElseThrow(() -> new StateException("New node is not rendered: " + fact));

    for (DocumentDelta delta : diff.deltas()) {
      if (delta.key().equals(changedKey)) {
        List<FieldChange> changes = delta.changes();
        if (delta.kind() != DocumentDelta.Kind.MODIFIED
            || changes.size() != 1
            || changes.get(0).op() != FieldChange.Op.CHANGED
            || !changes.get(0).fieldName().equals(fact.field())) {
          throw new StateException(
              "Update of %s changed document %s unexpectedly: %s"
                  .formatted(fact, changedKey, delta));
        }
      } else if (!delta.key().equals(placeholderKey)
          || delta.kind() != DocumentDelta.Kind.ADDED) {
        throw new StateException(
            "Update of %s leaked into unrelated document %s".formatted(fact, delta.key()));
      }
    }
    if (diff.deltaFor(changedKey).isEmpty()) {
      throw new StateException(
          "Update of %s left document %s unchanged".formatted(fact, changedKey));
    }
    return changedKey;
  }

  private static GraphPath pathTo(KnowledgeGraph graph, String focalNodeId, MutableFact fact) {
    return graph
        .shortestPath(focalNodeId, fact.nodeId())
        .orElseThrow(
            () ->
                new StateException(
                    "Changed node %s is not connected to %s"
                        .formatted(fact.nodeId(), focalNodeId)));
  }

  /** Names from the focal node to the changed node in the original graph, then the fact. */
  private static List<String> describePath(
      KnowledgeGraph graph, GraphPath path, MutableFact fact, String value) {
    List<String> out = new ArrayList<>(path.describe(graph));
    if (fact.kind() == UpdateKind.ATTRIBUTE) {
      out.add(fact.attribute() + "=" + value);
    } else {
      out.add(fact.edge().label());
      out.add(value);
    }
    return out;
  }

  /** Keep the attribute's scalar type when the proposed value can be read as that type. */
  static Object coerce(Object current, Object proposed) {
    if (proposed == null) return null;
    if (!(proposed instanceof String s)) return proposed;
    String text = s.trim();
    try {
      if (current instanceof Long || current instanceof Integer) return Long.valueOf(text);
      if (current instanceof Double) return Double.valueOf(text);
    } catch (NumberFormatException e) {
      return text;
    }
    if (current instanceof Boolean
        && ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text))) {
      return Boolean.valueOf(text);
    }
    return text;
  }
}
