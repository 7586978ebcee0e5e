package com.gentoro.kbgen.output;

import com.gentoro.kbgen.clarify.ClarificationKind;
import com.gentoro.kbgen.clarify.ClarificationSample;
import com.gentoro.kbgen.diff.MarkdownDiffFormatter;
import com.gentoro.kbgen.graph.GraphCodec;
import com.gentoro.kbgen.graph.KnowledgeGraph;
import com.gentoro.kbgen.query.QueryDeriver;
import com.gentoro.kbgen.query.QueryRecord;
import com.gentoro.kbgen.query.Shortfall;
import com.gentoro.kbgen.render.Document;
import com.gentoro.kbgen.render.DocumentLink;
import com.gentoro.kbgen.render.DocumentSet;
import com.gentoro.kbgen.update.UpdateScenario;
import com.gentoro.kbgen.utility.FileUtility;
import com.gentoro.kbgen.utility.JacksonUtility;
import com.gentoro.kbgen.utility.StringUtility;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import org.apache.commons.configuration2.Configuration;

/**
 * Writes generated artifacts to disk:
 *
 * <pre>
 * &lt;base-dir&gt;/&lt;scenario&gt;/&lt;instance-id&gt;/
 *   graph.json
 *   memory_&lt;focal-node&gt;_&lt;hash&gt;/
 *     base_memory.json
 *     retrieval_questions.json
 *     update_queries.json
 *     clarification_questions.json
 *     documents/&lt;key&gt;.md
 *     updates/&lt;hop&gt;_hop/&lt;n&gt;/&lt;key&gt;.md
 * </pre>
 *
 * <p>A memory directory is assembled under a hidden staging name and renamed into place once
 * complete, so readers never see a partial one.
 */
public class DatasetWriter {
  private static final org.slf4j.Logger log =
      com.gentoro.kbgen.logging.LoggingService.getLogger(DatasetWriter.class);

  public static final String GRAPH_FILE = "graph.json";
  public static final String BASE_MEMORY_FILE = "base_memory.json";
  public static final String QUESTIONS_FILE = "retrieval_questions.json";
  public static final String UPDATES_FILE = "update_queries.json";
  public static final String CLARIFICATIONS_FILE = "clarification_questions.json";
  public static final String DOCUMENTS_DIR = "documents";
  public static final String UPDATES_DIR = "updates";

  private final Path baseDir;
  private final MarkdownDiffFormatter diffFormatter;

  public DatasetWriter(Path baseDir, MarkdownDiffFormatter diffFormatter) {
    this.baseDir = baseDir;
    this.diffFormatter = diffFormatter;
  }

  public static DatasetWriter fromConfiguration(
      Configuration cfg, MarkdownDiffFormatter diffFormatter) {
    Path baseDir = Paths.get(cfg.getString("output.base-dir", "instances"));
    return new DatasetWriter(baseDir, diffFormatter);
  }

  public Path getBaseDir() {
    return baseDir;
  }

  public Path instanceDir(String scenarioName, String instanceId) {
    return baseDir.resolve(StringUtility.slug(scenarioName)).resolve(instanceId);
  }

  /**
   * Directory of one focal node. The slug keeps the name readable; the hash suffix keeps ids that
   * slug alike, such as {@code P1} and {@code p1}, apart.
   */
  public Path memoryDir(Path instanceDir, String focalNodeId) {
    String name = StringUtility.slug(focalNodeId) + "_" + StringUtility.shortHash(focalNodeId, 8);
    return instanceDir.resolve("memory_" + name);
  }

  public Path writeGraph(Path instanceDir, KnowledgeGraph graph) {
    Path file = FileUtility.ensureDirectory(instanceDir).resolve(GRAPH_FILE);
    GraphCodec.write(graph, file);
    log.debug("Wrote graph with {} node(s) to {}", graph.nodeCount(), file);
    return file;
  }

  /**
   * Write every artifact of one focal node pass and return the directory they went to. An
   * interrupted writer discards what it staged and throws {@link CancellationException}.
   */
  public Path writeMemory(
      Path instanceDir,
      DocumentSet documents,
      List<QueryRecord> questions,
      List<Shortfall> shortfalls,
      List<UpdateScenario> updates,
      List<ClarificationSample> clarifications) {
    Path target = memoryDir(instanceDir, documents.focalNodeId());
    Path staging = target.resolveSibling("." + target.getFileName() + ".partial");
    FileUtility.deleteDir(staging);
    Path dir = FileUtility.ensureDirectory(staging);
    try {
      writeArtifacts(dir, documents, questions, shortfalls, updates, clarifications);
      if (Thread.currentThread().isInterrupted()) {
        throw new CancellationException(
            "Writing memory of " + documents.focalNodeId() + " was interrupted");
      }
    } catch (RuntimeException e) {
      FileUtility.deleteDir(staging);
      if (Thread.currentThread().isInterrupted() && !(e instanceof CancellationException)) {
        // interruptible file channels fail the write instead of finishing it
        CancellationException cancelled =
            new CancellationException(
                "Writing memory of " + documents.focalNodeId() + " was interrupted");
        cancelled.initCause(e);
        throw cancelled;
      }
      throw e;
    }
    Path published = FileUtility.replaceDirectory(staging, target);
    log.debug(
        "Wrote {} document(s), {} question(s), {} update(s), {} clarification(s) to {}",
        documents.size(),
        questions.size(),
        updates.size(),
        clarifications.size(),
        published);
    return published;
  }

  private void writeArtifacts(
      Path dir,
      DocumentSet documents,
      List<QueryRecord> questions,
      List<Shortfall> shortfalls,
      List<UpdateScenario> updates,
      List<ClarificationSample> clarifications) {
    FileUtility.writeString(
        dir.resolve(BASE_MEMORY_FILE), JacksonUtility.toJson(baseMemory(documents)));
    writeMarkdown(dir.resolve(DOCUMENTS_DIR), documents, documents.keys());

    FileUtility.writeString(
        dir.resolve(QUESTIONS_FILE),
        JacksonUtility.toJson(retrievalQuestions(questions, shortfalls)));

    Map<String, List<Map<String, Object>>> updateRecords = new LinkedHashMap<>();
    for (int hop = 0; hop <= QueryDeriver.MAX_HOPS; hop++) {
      updateRecords.put(hop + "_hop", new ArrayList<>());
    }
    updates.stream()
        .sorted(Comparator.comparingInt(UpdateScenario::hopDistance))
        .forEach(
            update -> {
              String group = update.hopDistance() + "_hop";
              List<Map<String, Object>> records =
                  updateRecords.computeIfAbsent(group, k -> new ArrayList<>());
              writeMarkdown(
                  dir.resolve(UPDATES_DIR).resolve(group).resolve(String.valueOf(records.size())),
                  update.updatedDocuments(),
                  update.diff().changedKeys());
              records.add(updateRecord(documents, update));
            });
    FileUtility.writeString(dir.resolve(UPDATES_FILE), JacksonUtility.toJson(updateRecords));

    FileUtility.writeString(
        dir.resolve(CLARIFICATIONS_FILE),
        JacksonUtility.toJson(clarificationQuestions(clarifications)));
  }

  static Map<String, Object> baseMemory(DocumentSet documents) {
    List<Map<String, Object>> docs = new ArrayList<>();
    for (Document doc : documents.documents().values()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("key", doc.key());
      entry.put("file", DOCUMENTS_DIR + "/" + doc.key() + ".md");
      entry.put("nodeId", doc.nodeId());
      entry.put("title", doc.title());
      entry.put("links", doc.links().stream().map(DocumentLink::targetKey).distinct().toList());
      entry.put("content", doc.toMarkdown());
      docs.add(entry);
    }
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("focalNodeId", documents.focalNodeId());
    out.put("radius", documents.radius());
    out.put("documents", docs);
    return out;
  }

  static Map<String, Object> retrievalQuestions(
      List<QueryRecord> questions, List<Shortfall> shortfalls) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (int hop = 0; hop <= QueryDeriver.MAX_HOPS; hop++) {
      List<Map<String, Object>> items = new ArrayList<>();
      for (QueryRecord q : questions) {
        if (q.hopDistance() != hop) continue;
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("q", q.question());
        item.put("a", q.answer());
        item.put("attribute", q.attribute());
        item.put("path", q.path());
        items.add(item);
      }
      out.put(hop + "_hop", items);
    }
    if (!shortfalls.isEmpty()) {
      out.put("shortfalls", shortfalls);
    }
    return out;
  }

  static Map<String, Object> clarificationQuestions(List<ClarificationSample> clarifications) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (ClarificationKind kind : ClarificationKind.values()) {
      List<Map<String, Object>> items = new ArrayList<>();
      for (ClarificationSample c : clarifications) {
        if (c.kind() != kind) continue;
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("q", c.question());
        item.put("a", c.answer());
        item.put("subjectNodeId", c.subjectNodeId());
        item.put("attribute", c.attribute());
        item.put("rationale", c.rationale());
        items.add(item);
      }
      out.put(kind.label(), items);
    }
    return out;
  }

  private Map<String, Object> updateRecord(DocumentSet before, UpdateScenario update) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("kind", update.kind());
    out.put("hopDistance", update.hopDistance());
    out.put("changedNodeId", update.changedNodeId());
    out.put("changedDocument", update.changedDocumentKey());
    out.put("changedField", update.changedField());
    out.put("placeholderNodeId", update.placeholderNodeId());
    out.put("oldPath", update.oldPath());
    out.put("newPath", update.newPath());
    out.put("oldValue", update.oldValue());
    out.put("newValue", update.newValue());
    out.put("utterances", update.utterances());
    out.put("diff", update.diff());
    out.put("diffText", diffFormatter.format(before, update.diff()));
    return out;
  }

  private static void writeMarkdown(Path dir, DocumentSet documents, List<String> keys) {
    for (String key : keys) {
      if (!documents.contains(key)) continue;
      FileUtility.writeString(dir.resolve(key + ".md"), documents.get(key).toMarkdown());
    }
  }
}
