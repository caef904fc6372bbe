package com.flamingo.ai.mindmap.exception;

/** A finished tree violates a structural invariant. Indicates a defect, not bad input. */
public class TreeStructureException extends RuntimeException {

  private final String nodeId;

  public TreeStructureException(String nodeId, String message) {
    super("Node " + nodeId + ": " + message);
    this.nodeId = nodeId;
  }

  public String getNodeId() {
    return nodeId;
  }
}
