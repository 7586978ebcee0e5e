package com.gentoro.kbgen.diff;

import com.gentoro.kbgen.render.Document;
import com.gentoro.kbgen.render.DocumentSet;
import java.util.List;

/**
 * Line-level text form of a {@link DocumentDiff}: one {@code ===<key>.md===} block per changed
 * document with every line prefixed by {@code ' '}, {@code '-'} or {@code '+'}.
 */
public class MarkdownDiffFormatter {
  private final DocumentDiffer differ;

  public MarkdownDiffFormatter(DocumentDiffer differ) {
    this.differ = differ;
  }

  public String format(DocumentSet before, DocumentDiff diff) {
    DocumentSet after = differ.apply(before, diff);
    StringBuilder sb = new StringBuilder();
    for (DocumentDelta delta : diff.deltas()) {
      Document b = before.get(delta.key());
      Document a = after.get(delta.key());
      sb.append("===").append(delta.key()).append(".md===\n");
      sb.append("--- ").append(b == null ? "/dev/null" : "a/" + delta.key() + ".md").append('\n');
      sb.append("+++ ").append(a == null ? "/dev/null" : "b/" + delta.key() + ".md").append('\n');
      appendLines(sb, lines(b), lines(a));
    }
    return sb.toString();
  }

  private static List<String> lines(Document doc) {
    return doc == null ? List.of() : List.of(doc.toMarkdown().split("\n"));
  }

  private static void appendLines(StringBuilder sb, List<String> before, List<String> after) {
    int i = 0;
    int j = 0;
    for (int[] pair : Lcs.matches(before, after)) {
      for (; i < pair[0]; i++) sb.append('-').append(before.get(i)).append('\n');
      for (; j < pair[1]; j++) sb.append('+').append(after.get(j)).append('\n');
      sb.append(' ').append(before.get(i)).append('\n');
      i++;
      j++;
    }
    for (; i < before.size(); i++) sb.append('-').append(before.get(i)).append('\n');
    for (; j < after.size(); j++) sb.append('+').append(after.get(j)).append('\n');
  }
}
