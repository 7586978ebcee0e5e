package com.gentoro.kbgen.output;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.kbgen.clarify.ClarificationKind;
import com.gentoro.kbgen.clarify.ClarificationSample;
import com.gentoro.kbgen.diff.DocumentDiffer;
import com.gentoro.kbgen.diff.MarkdownDiffFormatter;
import com.gentoro.kbgen.graph.GraphCodec;
import com.gentoro.kbgen.graph.KnowledgeGraph;
import com.gentoro.kbgen.graph.SampleGraphs;
import com.gentoro.kbgen.query.QueryRecord;
import com.gentoro.kbgen.query.Shortfall;
import com.gentoro.kbgen.render.DocumentSet;
import com.gentoro.kbgen.render.NeighborhoodRenderer;
import com.gentoro.kbgen.update.Replacement;
import com.gentoro.kbgen.update.UpdateScenario;
import com.gentoro.kbgen.update.UpdateSimulator;
import com.gentoro.kbgen.utility.JacksonUtility;
import com.gentoro.kbgen.validation.GraphValidator;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DatasetWriterTest {
  @TempDir Path tempDir;

  private final NeighborhoodRenderer renderer = new NeighborhoodRenderer();
  private final DocumentDiffer differ = new DocumentDiffer();
  private DatasetWriter writer;
  private KnowledgeGraph graph;
  private DocumentSet documents;

  @BeforeEach
  void setUp() {
    writer = new DatasetWriter(tempDir, new MarkdownDiffFormatter(differ));
    graph = SampleGraphs.restaurantChain().freeze();
    documents = renderer.render(graph, "A");
  }

  private UpdateScenario relocateRestaurant() {
    UpdateSimulator simulator =
        new UpdateSimulator(
            renderer,
            new GraphValidator(),
            differ,
            (g, focal, fact, random) ->
                fact.field().equals("located_in")
                    ? new Replacement("D", List.of("The restaurant moved to D."))
                    : new Replacement(null, List.of()),
            5,
            Set.of());
    return simulator.simulate(graph, documents, "A", new Random(4));
  }

  @Test
  void laysOutInstanceDirectories() {
    Path instance = writer.instanceDir("St Mary's Emergency", "abc");
    assertEquals(tempDir.resolve("st_mary's_emergency").resolve("abc"), instance);
    Path dir = writer.memoryDir(instance, "p 1");
    assertTrue(dir.getFileName().toString().matches("memory_p_1_[0-9a-f]{8}"), dir.toString());
    assertEquals(dir, writer.memoryDir(instance, "p 1"));
  }

  @Test
  void idsThatSlugAlikeGetSeparateMemoryDirectories() {
    Path instance = tempDir.resolve("i");
    assertNotEquals(writer.memoryDir(instance, "P1"), writer.memoryDir(instance, "p1"));
    assertNotEquals(writer.memoryDir(instance, "p 1"), writer.memoryDir(instance, "p_1"));
    assertTrue(writer.memoryDir(instance, "P1").getFileName().toString().startsWith("memory_p1_"));
  }

  @Test
  void writesGraphThatReadsBack() {
    Path file = writer.writeGraph(tempDir.resolve("x"), graph);
    assertEquals(DatasetWriter.GRAPH_FILE, file.getFileName().toString());
    assertEquals(GraphCodec.toJson(graph), GraphCodec.toJson(GraphCodec.read(file)));
  }

  @Test
  void writesMemoryArtifacts() throws Exception {
    List<QueryRecord> questions =
        List.of(
            new QueryRecord(0, List.of("A", "age=34"), "age", "How old is A?", "34"),
            new QueryRecord(
                2,
                List.of("A", "works_at", "B", "located_in", "C", "population=90000"),
                "population",
                "What is the population of the city?",
                "90000"));
    Path dir =
        writer.writeMemory(
            tempDir,
            documents,
            questions,
            List.of(new Shortfall(1, 5, 2)),
            List.of(relocateRestaurant()),
            List.of(
                new ClarificationSample(
                    ClarificationKind.CONTRADICTION,
                    "Given that B serves Thai food, what else do I know?",
                    "Your memory says B serves Italian food. Which one is correct?",
                    "B",
                    "cuisine",
                    null)));

    assertEquals(writer.memoryDir(tempDir, "A"), dir);
    try (Stream<Path> siblings = Files.list(tempDir)) {
      assertEquals(List.of(dir), siblings.toList());
    }
    assertEquals(
        documents.get("restaurant/b").toMarkdown(),
        Files.readString(dir.resolve("documents/restaurant/b.md")));
    assertTrue(Files.isRegularFile(dir.resolve("documents/user.md")));
    assertTrue(Files.isRegularFile(dir.resolve("documents/city/c.md")));
    Path updateDir = dir.resolve("updates/1_hop/0");
    assertTrue(Files.readString(updateDir.resolve("restaurant/b.md")).contains("[D](city/d)"));
    assertTrue(Files.isRegularFile(updateDir.resolve("city/d.md")));
    assertFalse(Files.exists(updateDir.resolve("user.md")));

    JsonNode updates =
        JacksonUtility.getJsonMapper().readTree(dir.resolve(DatasetWriter.UPDATES_FILE).toFile());
    assertEquals(List.of("0_hop", "1_hop", "2_hop"), fieldNames(updates));
    assertEquals(0, updates.path("0_hop").size());
    assertEquals(1, updates.path("1_hop").size());
    JsonNode update = updates.path("1_hop").get(0);
    assertEquals("RELATIONSHIP", update.path("kind").asText());
    assertEquals(1, update.path("hopDistance").asInt());
    assertEquals("restaurant/b", update.path("changedDocument").asText());
    assertEquals("C", update.path("oldValue").asText());
    assertEquals("D", update.path("newValue").asText());
    assertEquals("D", update.path("newPath").path(4).asText());
    assertTrue(update.path("diffText").asText().contains("+++ b/city/d.md"));
    assertEquals(2, update.path("diff").path("deltas").size());

    JsonNode retrieval =
        JacksonUtility.getJsonMapper().readTree(dir.resolve(DatasetWriter.QUESTIONS_FILE).toFile());
    assertEquals("How old is A?", retrieval.path("0_hop").path(0).path("q").asText());
    assertEquals(0, retrieval.path("1_hop").size());
    assertEquals("90000", retrieval.path("2_hop").path(0).path("a").asText());
    assertEquals(5, retrieval.path("shortfalls").path(0).path("requested").asInt());

    JsonNode clarifications =
        JacksonUtility.getJsonMapper()
            .readTree(dir.resolve(DatasetWriter.CLARIFICATIONS_FILE).toFile());
    assertEquals(
        List.of("non_existing_entity", "non_existing_attribute", "contradiction"),
        fieldNames(clarifications));
    assertEquals(0, clarifications.path("non_existing_entity").size());
    JsonNode contradiction = clarifications.path("contradiction").get(0);
    assertEquals("cuisine", contradiction.path("attribute").asText());
    assertTrue(contradiction.path("a").asText().startsWith("Your memory says"));
  }

  @Test
  void rewritingMemoryReplacesThePreviousDirectory() throws Exception {
    Path first = writer.writeMemory(tempDir, documents, List.of(), List.of(), List.of(), List.of());
    Files.writeString(first.resolve("stale.txt"), "old");

    Path second =
        writer.writeMemory(tempDir, documents, List.of(), List.of(), List.of(), List.of());

    assertEquals(first, second);
    assertFalse(Files.exists(second.resolve("stale.txt")));
    assertTrue(Files.isRegularFile(second.resolve(DatasetWriter.BASE_MEMORY_FILE)));
  }

  @Test
  void interruptedWriterLeavesNoMemoryDirectory() throws Exception {
    Thread.currentThread().interrupt();
    try {
      assertThrows(
          CancellationException.class,
          () ->
              writer.writeMemory(tempDir, documents, List.of(), List.of(), List.of(), List.of()));
    } finally {
      Thread.interrupted();
    }
    try (Stream<Path> files = Files.list(tempDir)) {
      assertEquals(List.of(), files.toList());
    }
  }

  private static List<String> fieldNames(JsonNode node) {
    List<String> names = new ArrayList<>();
    node.fieldNames().forEachRemaining(names::add);
    return names;
  }

  @Test
  void baseMemoryListsDocumentsWithLinks() {
    Map<String, Object> memory = DatasetWriter.baseMemory(documents);
    assertEquals("A", memory.get("focalNodeId"));
    assertEquals(2, memory.get("radius"));

    @SuppressWarnings("unchecked")
    List<Map<String, Object>> docs = (List<Map<String, Object>>) memory.get("documents");
    assertEquals(
        List.of("user", "restaurant/b", "city/c"), docs.stream().map(d -> d.get("key")).toList());
    assertEquals("documents/user.md", docs.get(0).get("file"));
    assertEquals(List.of("restaurant/b"), docs.get(0).get("links"));
    assertEquals(List.of(), docs.get(2).get("links"));
  }

  @Test
  void retrievalQuestionsOmitEmptyShortfalls() {
    Map<String, Object> out = DatasetWriter.retrievalQuestions(List.of(), List.of());
    assertEquals(List.of("0_hop", "1_hop", "2_hop"), List.copyOf(out.keySet()));
  }
}
