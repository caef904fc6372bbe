package com.flamingo.ai.mindmap.domain.enums;

/** Why the tree builder stopped subdividing a node. */
public enum LeafReason {
  BELOW_MIN_SIZE,
  MAX_DEPTH_REACHED,

  /** Partitioning could not proceed (too few samples, duplicate or non-finite vectors). */
  DEGENERATE
}
