package com.gentoro.kbgen.graph;

/** Orientation of a traversed edge relative to the walk. */
public enum Direction {
  /** The walk follows the edge from its source to its target. */
  OUTGOING,
  /** The walk moves against the edge, from its target to its source. */
  INCOMING
}
