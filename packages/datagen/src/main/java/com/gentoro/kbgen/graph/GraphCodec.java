package com.gentoro.kbgen.graph;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.kbgen.exception.SerializationException;
import com.gentoro.kbgen.utility.FileUtility;
import com.gentoro.kbgen.utility.JacksonUtility;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON form of a {@link KnowledgeGraph}:
 *
 * <pre>
 * {"nodes":[{"id","type","name","createdAt","attributes":{...}}],
 *  "edges":[{"source","label","target"}]}
 * </pre>
 *
 * Decoding restores nodes, attribute order, ordinals and edge order exactly.
 */
public final class GraphCodec {
  private GraphCodec() {}

  record NodeRecord(
      String id,
      String type,
      String name,
      long createdAt,
      LinkedHashMap<String, Object> attributes) {}

  record EdgeRecord(String source, String label, String target) {}

  record GraphRecord(List<NodeRecord> nodes, List<EdgeRecord> edges) {}

  public static String toJson(KnowledgeGraph graph) {
    return JacksonUtility.toJson(toRecord(graph));
  }

  public static KnowledgeGraph fromJson(String json) {
    ObjectMapper mapper = JacksonUtility.getJsonMapper();
    GraphRecord record;
    try {
      record = mapper.readValue(json, GraphRecord.class);
    } catch (Exception e) {
      throw new SerializationException("Failed to parse knowledge graph JSON", e);
    }
    KnowledgeGraph graph = new KnowledgeGraph();
    if (record.nodes() != null) {
      for (NodeRecord n : record.nodes()) {
        graph.addNode(new Node(n.id(), n.type(), n.name(), n.attributes(), n.createdAt()));
      }
    }
    if (record.edges() != null) {
      for (EdgeRecord e : record.edges()) {
        graph.addEdge(e.source(), e.label(), e.target());
      }
    }
    return graph;
  }

  public static void write(KnowledgeGraph graph, Path file) {
    FileUtility.writeString(file, toJson(graph));
  }

  public static KnowledgeGraph read(Path file) {
    return fromJson(FileUtility.readString(file));
  }

  private static GraphRecord toRecord(KnowledgeGraph graph) {
    List<NodeRecord> nodes =
        graph.nodes().stream()
            .map(
                n -> {
                  LinkedHashMap<String, Object> attrs = new LinkedHashMap<>();
                  Map<String, Object> source = n.getAttributes();
                  source.forEach(attrs::put);
                  return new NodeRecord(
                      n.getId(), n.getType(), n.getName(), n.getCreatedAt(), attrs);
                })
            .toList();
    List<EdgeRecord> edges =
        graph.edges().stream().map(e -> new EdgeRecord(e.source(), e.label(), e.target())).toList();
    return new GraphRecord(nodes, edges);
  }
}
