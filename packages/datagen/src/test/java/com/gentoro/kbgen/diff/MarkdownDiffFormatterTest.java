package com.gentoro.kbgen.diff;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.kbgen.graph.Edge;
import com.gentoro.kbgen.graph.KnowledgeGraph;
import com.gentoro.kbgen.graph.SampleGraphs;
import com.gentoro.kbgen.render.DocumentSet;
import com.gentoro.kbgen.render.NeighborhoodRenderer;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MarkdownDiffFormatterTest {

  @Test
  void formatsChangedAndAddedDocuments() {
    NeighborhoodRenderer renderer = new NeighborhoodRenderer();
    DocumentDiffer differ = new DocumentDiffer();
    KnowledgeGraph before = SampleGraphs.restaurantChain();
    KnowledgeGraph after = before.copy();
    after.addNode("D", "city", "D", Map.of());
    after.replaceEdgeTarget(new Edge("B", "located_in", "C"), "D");

    DocumentSet b = renderer.render(before, "A");
    DocumentSet a = renderer.render(after, "A", 2, List.of("A", "B", "C", "D"));
    String text = new MarkdownDiffFormatter(differ).format(b, differ.diff(b, a));

    assertEquals(
        "===restaurant/b.md===\n"
            + "--- a/restaurant/b.md\n"
            + "+++ b/restaurant/b.md\n"
            + " # B\n"
            + " \n"
            + " ## Restaurant Information\n"
            + " - **Cuisine**: Italian\n"
            + " \n"
            + " ## Relationships\n"
            + "-- **Located In**: [C](city/c)\n"
            + "+- **Located In**: [D](city/d)\n"
            + "===city/d.md===\n"
            + "--- /dev/null\n"
            + "+++ b/city/d.md\n"
            + "+# D\n",
        text);
  }
}
