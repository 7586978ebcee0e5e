package com.gentoro.kbgen.exception;

import java.util.Map;

/** The focal node's rendered neighborhood has no fact that an update scenario could change. */
public class NoMutableFactException extends KbGenException {
  public NoMutableFactException(String focalNodeId) {
    super(
        KbGenErrorCode.NO_MUTABLE_FACT,
        "No mutable fact in the neighborhood of node " + focalNodeId,
        Map.of("focalNodeId", focalNodeId));
  }

  public NoMutableFactException(String focalNodeId, int hop) {
    super(
        KbGenErrorCode.NO_MUTABLE_FACT,
        "No mutable fact %d hop(s) from node %s".formatted(hop, focalNodeId),
        Map.of("focalNodeId", focalNodeId, "hop", hop));
  }
}
