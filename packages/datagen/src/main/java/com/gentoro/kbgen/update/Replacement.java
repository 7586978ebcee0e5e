package com.gentoro.kbgen.update;

import java.util.List;

/**
 * Proposed new value for a {@link MutableFact}: an attribute value, or the name of the node a
 * relationship should point to. {@code utterances} are user requests asking for the change.
 */
public record Replacement(Object newValue, List<String> utterances) {
  public Replacement {
    utterances = List.copyOf(utterances);
  }
}
