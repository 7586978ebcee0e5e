package com.gentoro.kbgen.diff;

import com.gentoro.kbgen.render.Document;
import java.util.List;

/**
 * Difference of the document stored under one key.
 *
 * <p>{@link Kind#ADDED} and {@link Kind#REMOVED} carry the whole document; {@link Kind#REPLACED}
 * (title or node changed) carries both; {@link Kind#MODIFIED} carries only field changes.
 */
public record DocumentDelta(
    String key, Kind kind, Document before, Document after, List<FieldChange> changes) {

  public enum Kind {
    ADDED,
    REMOVED,
    REPLACED,
    MODIFIED
  }

  public DocumentDelta {
    changes = List.copyOf(changes);
  }

  public DocumentDelta inverse() {
    Kind inverted =
        switch (kind) {
          case ADDED -> Kind.REMOVED;
          case REMOVED -> Kind.ADDED;
          case REPLACED -> Kind.REPLACED;
          case MODIFIED -> Kind.MODIFIED;
        };
    return new DocumentDelta(
        key, inverted, after, before, changes.stream().map(FieldChange::inverse).toList());
  }
}
