package com.gentoro.kbgen.query;

import com.gentoro.kbgen.graph.GraphPath;
import com.gentoro.kbgen.graph.KnowledgeGraph;
import java.util.ArrayList;
import java.util.List;

/**
 * A fact reachable from a focal node, before it is phrased as a question.
 *
 * @param hopDistance shortest undirected distance between the focal node and {@link #subjectId()}
 * @param path walk from the focal node to the node holding the fact
 * @param attribute attribute key holding the answer, or {@code null} when the answer is the node
 *     identity (its name)
 * @param answer expected answer
 */
public record QueryFact(int hopDistance, GraphPath path, String attribute, String answer) {

  /** Node the fact is about; the last node of the path. */
  public String subjectId() {
    return path.end();
  }

  public boolean isIdentity() {
    return attribute == null;
  }

  /** Node names interleaved with relation labels, ending with {@code attribute=value}. */
  public List<String> describe(KnowledgeGraph graph) {
    List<String> out = new ArrayList<>(path.describe(graph));
    if (attribute != null) {
      out.add(attribute + "=" + answer);
    }
    return out;
  }
}
