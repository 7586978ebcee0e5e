package com.gentoro.kbgen.diff;

import com.gentoro.kbgen.render.DocumentField;

/**
 * One field-level edit.
 *
 * @param op kind of edit
 * @param beforeIndex position in the old field list, {@code -1} for additions
 * @param afterIndex position in the new field list, {@code -1} for removals
 * @param before old field, {@code null} for additions
 * @param after new field, {@code null} for removals
 */
public record FieldChange(
    Op op, int beforeIndex, int afterIndex, DocumentField before, DocumentField after) {

  public enum Op {
    ADDED,
    REMOVED,
    CHANGED
  }

  public static FieldChange added(int afterIndex, DocumentField after) {
    return new FieldChange(Op.ADDED, -1, afterIndex, null, after);
  }

  public static FieldChange removed(int beforeIndex, DocumentField before) {
    return new FieldChange(Op.REMOVED, beforeIndex, -1, before, null);
  }

  public static FieldChange changed(
      int beforeIndex, int afterIndex, DocumentField before, DocumentField after) {
    return new FieldChange(Op.CHANGED, beforeIndex, afterIndex, before, after);
  }

  /** Name of the edited field. */
  public String fieldName() {
    DocumentField f = after != null ? after : before;
    return f.name();
  }

  public FieldChange inverse() {
    Op inverted =
        switch (op) {
          case ADDED -> Op.REMOVED;
          case REMOVED -> Op.ADDED;
          case CHANGED -> Op.CHANGED;
        };
    return new FieldChange(inverted, afterIndex, beforeIndex, after, before);
  }
}
