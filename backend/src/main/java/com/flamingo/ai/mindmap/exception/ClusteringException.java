package com.flamingo.ai.mindmap.exception;

/**
 * Thrown when a set of vectors cannot be partitioned, e.g. fewer than two samples, duplicate-only
 * or non-finite input. The tree builder recovers by turning the node into a leaf.
 */
public class ClusteringException extends RuntimeException {

  public ClusteringException(String message) {
    super(message);
  }
}
