package com.gentoro.kbgen.clarify;

import com.gentoro.kbgen.graph.KnowledgeGraph;
import com.gentoro.kbgen.graph.Node;
import com.gentoro.kbgen.render.DocumentSet;
import com.gentoro.kbgen.utility.StringUtility;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Deterministic clarification samples built from the rendered nodes. Used when no model is
 * configured; the output depends only on the graph, the documents and the random sequence.
 */
public class TemplateClarificationGenerator implements ClarificationGenerator {
  /** Attributes asked for when no other node of the same type suggests one. */
  static final List<String> FALLBACK_ATTRIBUTES =
      List.of("email", "phone_number", "birthday", "favorite_color", "website", "nickname");

  private static final Set<String> NEVER_ASKED = Set.of("id", "name", "full_name", "entity_type");

  @Override
  public Optional<ClarificationSample> generate(
      KnowledgeGraph graph, DocumentSet documents, ClarificationKind kind, Random random) {
    List<Node> rendered =
        documents.nodeIds().stream().filter(graph::containsNode).map(graph::node).toList();
    if (rendered.isEmpty()) return Optional.empty();
    return switch (kind) {
      case NON_EXISTENT_ENTITY -> Optional.of(unknownEntity(graph, rendered, random));
      case NON_EXISTENT_ATTRIBUTE -> missingAttribute(graph, rendered, random);
      case CONTRADICTION -> contradiction(graph, rendered, random);
    };
  }

  private ClarificationSample unknownEntity(
      KnowledgeGraph graph, List<Node> rendered, Random random) {
    List<Node> entities = rendered.stream().filter(n -> !n.isPerson()).toList();
    Node model = entities.isEmpty() ? rendered.get(0) : pick(entities, random);

    Set<String> names = new LinkedHashSet<>();
    graph.nodes().forEach(n -> names.add(n.getName()));
    String type = StringUtility.humanize(model.getType());
    String name;
    do {
      name = type + " " + (100 + random.nextInt(900));
    } while (names.contains(name));

    List<String> keys = askableKeys(model);
    String attribute = keys.isEmpty() ? null : pick(keys, random);
    String question =
        attribute == null
            ? "What do you know about " + name + "?"
            : "What is the " + StringUtility.phrase(attribute) + " of " + name + "?";
    String answer =
        "I don't have anything about "
            + name
            + " in your memory. Could you tell me which "
            + StringUtility.phrase(model.getType())
            + " you mean?";
    return new ClarificationSample(
        ClarificationKind.NON_EXISTENT_ENTITY,
        question,
        answer,
        null,
        attribute,
        "no node is named " + name);
  }

  private Optional<ClarificationSample> missingAttribute(
      KnowledgeGraph graph, List<Node> rendered, Random random) {
    List<Node> subjects = new ArrayList<>(rendered);
    while (!subjects.isEmpty()) {
      Node subject = subjects.remove(random.nextInt(subjects.size()));
      List<String> missing = missingKeys(graph, subject);
      if (missing.isEmpty()) continue;
      String attribute = pick(missing, random);
      String property = StringUtility.phrase(attribute);
      return Optional.of(
          new ClarificationSample(
              ClarificationKind.NON_EXISTENT_ATTRIBUTE,
              "What is the " + property + " of " + subject.getName() + "?",
              "Your memory doesn't record the "
                  + property
                  + " of "
                  + subject.getName()
                  + ". Do you want to tell me so I can note it?",
              subject.getId(),
              attribute,
              subject.getName() + " has no " + attribute + " attribute"));
    }
    return Optional.empty();
  }

  private Optional<ClarificationSample> contradiction(
      KnowledgeGraph graph, List<Node> rendered, Random random) {
    List<Node> subjects = rendered.stream().filter(n -> !askableKeys(n).isEmpty()).toList();
    if (subjects.isEmpty()) return Optional.empty();
    Node subject = pick(subjects, random);
    String attribute = pick(askableKeys(subject), random);
    Object actual = subject.getAttributes().get(attribute);
    Object wrong = conflictingValue(graph, subject, attribute, actual, random);
    String property = StringUtility.phrase(attribute);
    return Optional.of(
        new ClarificationSample(
            ClarificationKind.CONTRADICTION,
            "Given that the "
                + property
                + " of "
                + subject.getName()
                + " is "
                + wrong
                + ", what else do you have on "
                + subject.getName()
                + "?",
            "Your memory says the "
                + property
                + " of "
                + subject.getName()
                + " is "
                + actual
                + ", not "
                + wrong
                + ". Which one is correct?",
            subject.getId(),
            attribute,
            "memory records " + actual));
  }

  /** A value of the same kind as {@code actual} that differs from it. */
  static Object conflictingValue(
      KnowledgeGraph graph, Node subject, String attribute, Object actual, Random random) {
    if (actual instanceof Long l) {
      return l + 1 + random.nextInt(5);
    }
    if (actual instanceof Double d) {
      return d + 1.5;
    }
    if (actual instanceof Boolean b) {
      return !b;
    }
    List<Object> others = new ArrayList<>();
    for (Node n : graph.nodes()) {
      if (n.getId().equals(subject.getId())) continue;
      Object v = n.getAttributes().get(attribute);
      if (v != null && !Objects.equals(v, actual) && !others.contains(v)) others.add(v);
    }
    if (!others.isEmpty()) {
      return pick(others, random);
    }
    return StringUtility.humanize(attribute) + " " + (2 + random.nextInt(98));
  }

  private static List<String> missingKeys(KnowledgeGraph graph, Node subject) {
    Set<String> keys = new LinkedHashSet<>();
    for (Node n : graph.nodes()) {
      if (n.getType().equals(subject.getType())) keys.addAll(n.getAttributes().keySet());
    }
    keys.addAll(FALLBACK_ATTRIBUTES);
    keys.removeAll(subject.getAttributes().keySet());
    keys.removeAll(NEVER_ASKED);
    return List.copyOf(keys);
  }

  private static List<String> askableKeys(Node node) {
    List<String> keys = new ArrayList<>();
    for (Map.Entry<String, Object> e : node.getAttributes().entrySet()) {
      if (!NEVER_ASKED.contains(e.getKey()) && e.getValue() != null) keys.add(e.getKey());
    }
    return keys;
  }

  private static <T> T pick(List<T> items, Random random) {
    return items.get(random.nextInt(items.size()));
  }
}
