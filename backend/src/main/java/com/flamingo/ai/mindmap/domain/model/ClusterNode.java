package com.flamingo.ai.mindmap.domain.model;

import com.flamingo.ai.mindmap.domain.enums.LeafReason;
import com.flamingo.ai.mindmap.domain.enums.NodeKind;
import java.util.List;
import lombok.Getter;

/**
 * A topic in the mindmap tree.
 *
 * <p>Structure (id, depth, kind, members, child ids) is fixed when the tree builder creates the
 * node. Only the enrichment fields are written afterwards: label and description by the enricher,
 * relationships (leaves only) by the relationship extractor.
 */
@Getter
public class ClusterNode {

  private final String id;
  private final int depth;
  private final NodeKind kind;
  private final List<Integer> memberIndices;
  private final List<String> childIds;
  private final ClusterLimits limits;
  private final LeafReason leafReason;

  private String label;
  private String description;
  private List<Relationship> relationships = List.of();

  private ClusterNode(
      String id,
      int depth,
      NodeKind kind,
      List<Integer> memberIndices,
      List<String> childIds,
      ClusterLimits limits,
      LeafReason leafReason) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Node id is required");
    }
    if (depth < 0) {
      throw new IllegalArgumentException("Node depth must be >= 0: " + depth);
    }
    if (memberIndices == null || memberIndices.isEmpty()) {
      throw new IllegalArgumentException("Node " + id + " has no members");
    }
    this.id = id;
    this.depth = depth;
    this.kind = kind;
    this.memberIndices = List.copyOf(memberIndices);
    this.childIds = List.copyOf(childIds);
    this.limits = limits;
    this.leafReason = leafReason;
  }

  public static ClusterNode leaf(
      String id, int depth, List<Integer> memberIndices, ClusterLimits limits, LeafReason reason) {
    if (reason == null) {
      throw new IllegalArgumentException("Leaf " + id + " requires a leaf reason");
    }
    return new ClusterNode(id, depth, NodeKind.LEAF, memberIndices, List.of(), limits, reason);
  }

  public static ClusterNode internal(
      String id, int depth, List<Integer> memberIndices, List<String> childIds,
      ClusterLimits limits) {
    if (childIds == null || childIds.isEmpty()) {
      throw new IllegalArgumentException("Internal node " + id + " requires children");
    }
    return new ClusterNode(id, depth, NodeKind.INTERNAL, memberIndices, childIds, limits, null);
  }

  public boolean isLeaf() {
    return kind == NodeKind.LEAF;
  }

  public int size() {
    return memberIndices.size();
  }

  public boolean hasLabel() {
    return label != null && !label.isBlank();
  }

  public void setLabel(String label) {
    this.label = label;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public void setRelationships(List<Relationship> relationships) {
    if (!isLeaf() && !relationships.isEmpty()) {
      throw new IllegalStateException("Relationships are only recorded on leaf nodes: " + id);
    }
    this.relationships = List.copyOf(relationships);
  }

  @Override
  public String toString() {
    return "ClusterNode{id='" + id + "', depth=" + depth + ", kind=" + kind
        + ", size=" + memberIndices.size() + ", label='" + label + "'}";
  }
}
