package com.gentoro.kbgen.update;

public enum UpdateKind {
  /** An attribute value of a node was replaced. */
  ATTRIBUTE,
  /** An edge now points at a different (newly created) node. */
  RELATIONSHIP
}
