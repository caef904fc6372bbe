package com.flamingo.ai.mindmap.domain.enums;

/** Shape of a cluster node, fixed at construction. */
public enum NodeKind {
  /** Terminal topic; holds member segments but no children. */
  LEAF,

  /** Topic subdivided into at least one child cluster. */
  INTERNAL
}
