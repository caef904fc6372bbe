package com.flamingo.ai.mindmap.domain.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.mindmap.domain.enums.LeafReason;
import com.flamingo.ai.mindmap.domain.enums.RelationshipKind;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ClusterTreeTest {

  private static final ClusterLimits LIMITS = new ClusterLimits(2, 2);

  @Test
  @DisplayName("should walk nodes in pre-order with children in stored order")
  void shouldWalkPreOrder() {
    ClusterTree tree = sampleTree();

    assertThat(tree.preOrder())
        .extracting(ClusterNode::getId)
        .containsExactly("root", "root_0", "root_0_0", "root_0_1", "root_1");
    assertThat(tree.leaves())
        .extracting(ClusterNode::getId)
        .containsExactly("root_0_0", "root_0_1", "root_1");
    assertThat(tree.maxDepth()).isEqualTo(2);
    assertThat(tree.size()).isEqualTo(5);
  }

  @Test
  @DisplayName("should resolve parents by id")
  void shouldResolveParents() {
    ClusterTree tree = sampleTree();

    assertThat(tree.parentOf(tree.get("root_0_1"))).map(ClusterNode::getId).contains("root_0");
    assertThat(tree.parentOf(tree.getRoot())).isEmpty();
  }

  @Test
  @DisplayName("should reject duplicate ids and a second root")
  void shouldRejectInvalidAdds() {
    ClusterTree tree = sampleTree();

    assertThatThrownBy(
            () ->
                tree.add(
                    ClusterNode.leaf("root_1", 1, List.of(4), LIMITS, LeafReason.BELOW_MIN_SIZE),
                    "root"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Duplicate");
    assertThatThrownBy(
            () ->
                tree.add(
                    ClusterNode.leaf("other", 0, List.of(0), LIMITS, LeafReason.BELOW_MIN_SIZE),
                    null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("should refuse relationships on internal nodes")
  void shouldRefuseRelationshipsOnInternalNodes() {
    ClusterTree tree = sampleTree();
    Relationship relationship = new Relationship(0, 1, 0.9, RelationshipKind.SEMANTIC_SIMILARITY);

    assertThatThrownBy(() -> tree.getRoot().setRelationships(List.of(relationship)))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("should reject self links and out-of-range confidence")
  void shouldValidateRelationships() {
    assertThatThrownBy(() -> new Relationship(1, 1, 0.9, RelationshipKind.SEMANTIC_SIMILARITY))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new Relationship(0, 1, 1.2, RelationshipKind.SEMANTIC_SIMILARITY))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static ClusterTree sampleTree() {
    ClusterTree tree = new ClusterTree();
    tree.add(
        ClusterNode.internal("root", 0, List.of(0, 1, 2, 3, 4), List.of("root_0", "root_1"),
            LIMITS),
        null);
    tree.add(
        ClusterNode.internal("root_0", 1, List.of(0, 1, 2), List.of("root_0_0", "root_0_1"),
            LIMITS),
        "root");
    tree.add(
        ClusterNode.leaf("root_0_0", 2, List.of(0, 1), LIMITS, LeafReason.MAX_DEPTH_REACHED),
        "root_0");
    tree.add(
        ClusterNode.leaf("root_0_1", 2, List.of(2), LIMITS, LeafReason.BELOW_MIN_SIZE), "root_0");
    tree.add(
        ClusterNode.leaf("root_1", 1, List.of(3, 4), LIMITS, LeafReason.MAX_DEPTH_REACHED), "root");
    return tree;
  }
}
