package com.gentoro.kbgen.render;

import com.gentoro.kbgen.exception.LinkResolutionException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The documents rendered for one focal node's neighborhood, keyed by document key in rendering
 * order.
 */
public record DocumentSet(String focalNodeId, int radius, Map<String, Document> documents) {
  public static final String FOCAL_KEY = "user";

  public DocumentSet {
    documents = Collections.unmodifiableMap(new LinkedHashMap<>(documents));
  }

  public static DocumentSet of(String focalNodeId, int radius, List<Document> documents) {
    Map<String, Document> byKey = new LinkedHashMap<>();
    for (Document d : documents) {
      if (byKey.putIfAbsent(d.key(), d) != null) {
        throw new IllegalArgumentException("Duplicate document key: " + d.key());
      }
    }
    return new DocumentSet(focalNodeId, radius, byKey);
  }

  public Document get(String key) {
    return documents.get(key);
  }

  public boolean contains(String key) {
    return documents.containsKey(key);
  }

  public List<String> keys() {
    return List.copyOf(documents.keySet());
  }

  public int size() {
    return documents.size();
  }

  public Optional<Document> forNode(String nodeId) {
    return documents.values().stream().filter(d -> d.nodeId().equals(nodeId)).findFirst();
  }

  public List<String> nodeIds() {
    return documents.values().stream().map(Document::nodeId).toList();
  }

  /** Every link must resolve inside this set. */
  public DocumentSet checkClosure() {
    for (Document d : documents.values()) {
      for (DocumentLink link : d.links()) {
        if (!documents.containsKey(link.targetKey())) {
          throw new LinkResolutionException(d.key(), link.targetKey());
        }
      }
    }
    return this;
  }
}
