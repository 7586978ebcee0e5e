package com.gentoro.kbgen.update;

import com.gentoro.kbgen.graph.KnowledgeGraph;
import com.gentoro.kbgen.graph.Node;
import com.gentoro.kbgen.utility.StringUtility;
import java.util.List;
import java.util.Random;

/**
 * Offline replacement values: numbers are shifted, booleans flipped and strings replaced by a
 * numbered label. Every value drawn depends only on {@code random}.
 */
public class DeterministicReplacementSource implements ReplacementSource {

  @Override
  public Replacement propose(
      KnowledgeGraph graph, String focalNodeId, MutableFact fact, Random random) {
    Node node = graph.node(fact.nodeId());
    if (fact.kind() == UpdateKind.ATTRIBUTE) {
      Object value = nextValue(fact.attribute(), fact.currentValue(), random);
      String utterance =
          "Please update the %s of %s to %s."
              .formatted(StringUtility.phrase(fact.attribute()), node.getName(), value);
      return new Replacement(value, List.of(utterance));
    }
    Node oldTarget = graph.node(fact.edge().target());
    String name =
        "New %s %d".formatted(StringUtility.humanize(oldTarget.getType()), 1 + random.nextInt(999));
    String utterance =
        "%s no longer %s %s; it is %s now."
            .formatted(
                node.getName(),
                StringUtility.phrase(fact.edge().label()),
                oldTarget.getName(),
                name);
    return new Replacement(name, List.of(utterance));
  }

  static Object nextValue(String attribute, Object current, Random random) {
    int delta = 1 + random.nextInt(9);
    if (current instanceof Long l) return l + delta;
    if (current instanceof Double d) return d + delta;
    if (current instanceof Boolean b) return !b;
    return "%s %d".formatted(StringUtility.humanize(attribute), 100 + random.nextInt(900));
  }
}
