package com.flamingo.ai.mindmap.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.mindmap.domain.model.ClusterNode;
import com.flamingo.ai.mindmap.domain.model.ClusterTree;
import com.flamingo.ai.mindmap.domain.model.Relationship;
import java.util.List;

/**
 * Response DTO for one mindmap node with its nested children. Relationships are present on leaves
 * only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MindmapNodeResponse(
    String id,
    String label,
    String description,
    int size,
    List<Relationship> relationships,
    List<MindmapNodeResponse> children) {

  /** Converts the subtree rooted at {@code node}. */
  public static MindmapNodeResponse from(ClusterTree tree, ClusterNode node) {
    List<MindmapNodeResponse> children =
        tree.children(node).stream().map(child -> from(tree, child)).toList();
    return new MindmapNodeResponse(
        node.getId(),
        node.getLabel(),
        node.getDescription(),
        node.size(),
        node.isLeaf() ? node.getRelationships() : null,
        children);
  }
}
