package com.gentoro.kbgen.diff;

import java.util.List;
import java.util.Optional;

/**
 * Structural difference between two document sets. Key orders of both sides are kept so that
 * applying the diff reproduces the target set exactly, iteration order included.
 */
public record DocumentDiff(
    List<String> beforeKeys, List<String> afterKeys, List<DocumentDelta> deltas) {
  public DocumentDiff {
    beforeKeys = List.copyOf(beforeKeys);
    afterKeys = List.copyOf(afterKeys);
    deltas = List.copyOf(deltas);
  }

  public boolean hasNoChanges() {
    return deltas.isEmpty() && beforeKeys.equals(afterKeys);
  }

  /** Keys whose content differs between the two sides. */
  public List<String> changedKeys() {
    return deltas.stream().map(DocumentDelta::key).toList();
  }

  public Optional<DocumentDelta> deltaFor(String key) {
    return deltas.stream().filter(d -> d.key().equals(key)).findFirst();
  }

  public DocumentDiff inverse() {
    return new DocumentDiff(
        afterKeys, beforeKeys, deltas.stream().map(DocumentDelta::inverse).toList());
  }
}
