package com.flamingo.ai.mindmap.domain.model;

import com.flamingo.ai.mindmap.domain.enums.RelationshipKind;

/**
 * Directed, confidence-scored link between two segments of one leaf cluster. A link from A to B
 * does not imply a link from B to A.
 *
 * @param sourceIndex global index of the source segment
 * @param targetIndex global index of the target segment
 * @param confidence similarity in [0, 1]
 * @param kind link kind
 */
public record Relationship(
    int sourceIndex, int targetIndex, double confidence, RelationshipKind kind) {

  public Relationship {
    if (sourceIndex == targetIndex) {
      throw new IllegalArgumentException("Relationship cannot link segment to itself");
    }
    if (confidence < 0.0 || confidence > 1.0) {
      throw new IllegalArgumentException("Confidence must be within [0, 1]: " + confidence);
    }
  }
}
