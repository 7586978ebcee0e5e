package com.gentoro.kbgen.diff;

import com.gentoro.kbgen.exception.StateException;
import com.gentoro.kbgen.render.Document;
import com.gentoro.kbgen.render.DocumentField;
import com.gentoro.kbgen.render.DocumentSet;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes and applies {@link DocumentDiff}s.
 *
 * <p>Field lists are aligned with a longest common subsequence over {@link FieldKey}s. Aligned
 * fields whose value or link differ become {@code CHANGED}; the rest become {@code ADDED} or
 * {@code REMOVED}. Every change records its index on both sides, which is enough to rebuild
 * either side from the other.
 */
public class DocumentDiffer {

  public DocumentDiff diff(DocumentSet before, DocumentSet after) {
    Set<String> keys = new LinkedHashSet<>(before.keys());
    keys.addAll(after.keys());

    List<DocumentDelta> deltas = new ArrayList<>();
    for (String key : keys) {
      Document b = before.get(key);
      Document a = after.get(key);
      if (b == null) {
        deltas.add(new DocumentDelta(key, DocumentDelta.Kind.ADDED, null, a, List.of()));
      } else if (a == null) {
        deltas.add(new DocumentDelta(key, DocumentDelta.Kind.REMOVED, b, null, List.of()));
      } else if (!b.title().equals(a.title()) || !b.nodeId().equals(a.nodeId())) {
        deltas.add(new DocumentDelta(key, DocumentDelta.Kind.REPLACED, b, a, List.of()));
      } else {
        List<FieldChange> changes = diffFields(b.fields(), a.fields());
        if (!changes.isEmpty()) {
          deltas.add(new DocumentDelta(key, DocumentDelta.Kind.MODIFIED, null, null, changes));
        }
      }
    }
    return new DocumentDiff(before.keys(), after.keys(), deltas);
  }

  public List<FieldChange> diffFields(List<DocumentField> before, List<DocumentField> after) {
    List<int[]> matched = Lcs.matches(FieldKey.keysOf(before), FieldKey.keysOf(after));
    List<FieldChange> changes = new ArrayList<>();
    int i = 0;
    int j = 0;
    for (int[] pair : matched) {
      for (; i < pair[0]; i++) changes.add(FieldChange.removed(i, before.get(i)));
      for (; j < pair[1]; j++) changes.add(FieldChange.added(j, after.get(j)));
      if (!before.get(i).equals(after.get(j))) {
        changes.add(FieldChange.changed(i, j, before.get(i), after.get(j)));
      }
      i++;
      j++;
    }
    for (; i < before.size(); i++) changes.add(FieldChange.removed(i, before.get(i)));
    for (; j < after.size(); j++) changes.add(FieldChange.added(j, after.get(j)));
    return changes;
  }

  /**
   * Rebuild the target side of {@code diff} from its source side.
   *
   * @throws StateException when {@code before} is not the set the diff was computed from
   */
  public DocumentSet apply(DocumentSet before, DocumentDiff diff) {
    if (!before.keys().equals(diff.beforeKeys())) {
      throw new StateException(
          "Diff expects documents %s but got %s".formatted(diff.beforeKeys(), before.keys()));
    }
    Map<String, DocumentDelta> byKey = new HashMap<>();
    diff.deltas().forEach(d -> byKey.put(d.key(), d));

    Map<String, Document> out = new LinkedHashMap<>();
    for (String key : diff.afterKeys()) {
      DocumentDelta delta = byKey.get(key);
      if (delta == null) {
        out.put(key, require(before, key));
        continue;
      }
      switch (delta.kind()) {
        case ADDED, REPLACED -> out.put(key, delta.after());
        case MODIFIED -> {
          Document doc = require(before, key);
          out.put(key, doc.withFields(applyFields(doc.fields(), delta.changes())));
        }
        case REMOVED -> throw new StateException("Removed document " + key + " listed as kept");
      }
    }
    return new DocumentSet(before.focalNodeId(), before.radius(), out);
  }

  public List<DocumentField> applyFields(List<DocumentField> before, List<FieldChange> changes) {
    Set<Integer> removed = new HashSet<>();
    Map<Integer, DocumentField> replaced = new HashMap<>();
    List<FieldChange> added = new ArrayList<>();
    for (FieldChange c : changes) {
      switch (c.op()) {
        case REMOVED -> removed.add(c.beforeIndex());
        case CHANGED -> replaced.put(c.beforeIndex(), c.after());
        case ADDED -> added.add(c);
      }
    }
    List<DocumentField> out = new ArrayList<>();
    for (int i = 0; i < before.size(); i++) {
      if (removed.contains(i)) continue;
      out.add(replaced.getOrDefault(i, before.get(i)));
    }
    added.sort(Comparator.comparingInt(FieldChange::afterIndex));
    for (FieldChange c : added) {
      if (c.afterIndex() > out.size()) {
        throw new StateException("Field change points past the end of the document: " + c);
      }
      out.add(c.afterIndex(), c.after());
    }
    return out;
  }

  private static Document require(DocumentSet set, String key) {
    Document doc = set.get(key);
    if (doc == null) throw new StateException("Document missing from source set: " + key);
    return doc;
  }
}
