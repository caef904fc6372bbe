package com.flamingo.ai.mindmap.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Kind of link between two segments of the same leaf cluster. */
public enum RelationshipKind {
  SEMANTIC_SIMILARITY("semantic_similarity");

  private final String value;

  RelationshipKind(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
