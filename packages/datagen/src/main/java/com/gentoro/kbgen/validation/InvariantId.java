package com.gentoro.kbgen.validation;

/** Structural invariants every knowledge graph must satisfy, in reporting order. */
public enum InvariantId {
  /** Every edge endpoint references an existing node id. */
  EDGE_ENDPOINT_EXISTS,
  /** No two person nodes share the same name. */
  UNIQUE_PERSON_NAME,
  /** Every node carries a non-empty attribute or at least one incident edge. */
  NO_EMPTY_NODE,
  /** No two nodes share an id. */
  UNIQUE_NODE_ID
}
