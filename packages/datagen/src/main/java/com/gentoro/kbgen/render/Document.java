package com.gentoro.kbgen.render;

import com.gentoro.kbgen.utility.StringUtility;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rendered view of one graph node.
 *
 * <p>The field list is the canonical content; {@link #toMarkdown()} is derived from it, so two
 * documents with equal fields always produce byte-identical markdown.
 */
public record Document(String key, String nodeId, String title, List<DocumentField> fields) {
  public static final String RELATIONSHIPS = "Relationships";

  public Document {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(nodeId, "nodeId");
    Objects.requireNonNull(title, "title");
    fields = List.copyOf(fields);
  }

  public List<DocumentLink> links() {
    return fields.stream()
        .filter(DocumentField::hasLink)
        .map(f -> new DocumentLink(f.name(), f.link()))
        .toList();
  }

  /** Copy of this document carrying a different field list. */
  public Document withFields(List<DocumentField> newFields) {
    return new Document(key, nodeId, title, newFields);
  }

  public String toMarkdown() {
    Map<String, List<DocumentField>> bySection = new LinkedHashMap<>();
    for (DocumentField f : fields) {
      bySection.computeIfAbsent(f.section(), k -> new ArrayList<>()).add(f);
    }
    StringBuilder sb = new StringBuilder();
    sb.append("# ").append(title).append('\n');
    bySection.forEach(
        (section, sectionFields) -> {
          sb.append('\n').append("## ").append(section).append('\n');
          for (DocumentField f : sectionFields) {
            sb.append("- **").append(StringUtility.humanize(f.name())).append("**: ");
            if (f.hasLink()) {
              sb.append('[').append(f.value()).append("](").append(f.link()).append(')');
            } else {
              sb.append(f.value());
            }
            sb.append('\n');
          }
        });
    return sb.toString();
  }
}
