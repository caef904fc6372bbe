package com.flamingo.ai.mindmap.service.mindmap;

import com.flamingo.ai.mindmap.domain.enums.LeafReason;
import com.flamingo.ai.mindmap.domain.model.ClusterNode;
import com.flamingo.ai.mindmap.domain.model.ClusterTree;
import com.flamingo.ai.mindmap.domain.model.Relationship;
import com.flamingo.ai.mindmap.exception.TreeStructureException;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Verifies a finished tree before it leaves the pipeline. A violation means a defect in tree
 * construction or enrichment, never bad input.
 */
@Component
public class TreeStructureValidator {

  /**
   * Checks every node.
   *
   * @param tree enriched tree
   * @param segmentCount number of segments the tree was built from
   * @throws TreeStructureException on the first violation found
   */
  public void validate(ClusterTree tree, int segmentCount) {
    ClusterNode root = tree.getRoot();
    if (!ClusterTree.ROOT_ID.equals(root.getId()) || root.getDepth() != 0) {
      throw new TreeStructureException(root.getId(), "root must have id 'root' and depth 0");
    }
    if (root.size() != segmentCount || !coversRange(root.getMemberIndices(), segmentCount)) {
      throw new TreeStructureException(root.getId(), "root must hold every segment exactly once");
    }

    for (ClusterNode node : tree.preOrder()) {
      if (!node.hasLabel()) {
        throw new TreeStructureException(node.getId(), "missing label");
      }
      Optional<ClusterNode> parent = tree.parentOf(node);
      if (parent.isPresent()) {
        checkAgainstParent(node, parent.get());
      }
      if (node.isLeaf()) {
        checkLeaf(node);
      } else {
        checkPartition(tree, node);
      }
    }
  }

  private static void checkAgainstParent(ClusterNode node, ClusterNode parent) {
    if (node.getDepth() != parent.getDepth() + 1) {
      throw new TreeStructureException(node.getId(), "depth must be parent depth + 1");
    }
    if (!node.getId().startsWith(parent.getId() + "_")) {
      throw new TreeStructureException(node.getId(), "id must extend parent id " + parent.getId());
    }
  }

  private static void checkLeaf(ClusterNode leaf) {
    if (!leaf.getChildIds().isEmpty()) {
      throw new TreeStructureException(leaf.getId(), "leaf must not have children");
    }
    if (leaf.getLeafReason() != LeafReason.DEGENERATE
        && leaf.size() >= leaf.getLimits().minSize()
        && leaf.getDepth() < leaf.getLimits().maxDepth()) {
      throw new TreeStructureException(leaf.getId(), "leaf meets no stop condition");
    }
    Set<Integer> members = new HashSet<>(leaf.getMemberIndices());
    for (Relationship relationship : leaf.getRelationships()) {
      if (!members.contains(relationship.sourceIndex())
          || !members.contains(relationship.targetIndex())) {
        throw new TreeStructureException(leaf.getId(), "relationship crosses cluster boundary");
      }
    }
  }

  private static void checkPartition(ClusterTree tree, ClusterNode node) {
    if (!node.getRelationships().isEmpty()) {
      throw new TreeStructureException(node.getId(), "internal node carries relationships");
    }
    Set<Integer> union = new HashSet<>();
    int total = 0;
    for (ClusterNode child : tree.children(node)) {
      union.addAll(child.getMemberIndices());
      total += child.size();
    }
    if (total != union.size()) {
      throw new TreeStructureException(node.getId(), "children share members");
    }
    if (!union.equals(new HashSet<>(node.getMemberIndices()))) {
      throw new TreeStructureException(node.getId(), "children do not cover the node's members");
    }
  }

  private static boolean coversRange(List<Integer> indices, int count) {
    Set<Integer> unique = new HashSet<>(indices);
    if (unique.size() != count) {
      return false;
    }
    for (int i = 0; i < count; i++) {
      if (!unique.contains(i)) {
        return false;
      }
    }
    return true;
  }
}
