package com.flamingo.ai.mindmap.domain.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flat arena of cluster nodes keyed by id. Parents reference their children by id, so no node is
 * reachable through two owners.
 */
public class ClusterTree {

  public static final String ROOT_ID = "root";

  private final Map<String, ClusterNode> nodes = new LinkedHashMap<>();
  private final Map<String, String> parentIds = new LinkedHashMap<>();

  /**
   * Registers a node.
   *
   * @param node the node
   * @param parentId id of its parent, null for the root
   */
  public void add(ClusterNode node, String parentId) {
    if (nodes.containsKey(node.getId())) {
      throw new IllegalArgumentException("Duplicate node id: " + node.getId());
    }
    if (parentId == null && !nodes.isEmpty()) {
      throw new IllegalArgumentException("Tree already has a root, got " + node.getId());
    }
    nodes.put(node.getId(), node);
    if (parentId != null) {
      parentIds.put(node.getId(), parentId);
    }
  }

  public ClusterNode getRoot() {
    if (nodes.isEmpty()) {
      throw new IllegalStateException("Tree is empty");
    }
    return nodes.values().iterator().next();
  }

  public ClusterNode get(String id) {
    ClusterNode node = nodes.get(id);
    if (node == null) {
      throw new IllegalArgumentException("Unknown node id: " + id);
    }
    return node;
  }

  public boolean contains(String id) {
    return nodes.containsKey(id);
  }

  public Optional<ClusterNode> parentOf(ClusterNode node) {
    return Optional.ofNullable(parentIds.get(node.getId())).map(nodes::get);
  }

  public List<ClusterNode> children(ClusterNode node) {
    List<ClusterNode> children = new ArrayList<>(node.getChildIds().size());
    for (String childId : node.getChildIds()) {
      children.add(get(childId));
    }
    return children;
  }

  /** Nodes in depth-first pre-order, children in their stored order. */
  public List<ClusterNode> preOrder() {
    List<ClusterNode> ordered = new ArrayList<>(nodes.size());
    if (nodes.isEmpty()) {
      return ordered;
    }
    Deque<ClusterNode> stack = new ArrayDeque<>();
    stack.push(getRoot());
    while (!stack.isEmpty()) {
      ClusterNode node = stack.pop();
      ordered.add(node);
      List<ClusterNode> children = children(node);
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
    return ordered;
  }

  public List<ClusterNode> leaves() {
    return preOrder().stream().filter(ClusterNode::isLeaf).toList();
  }

  public Collection<ClusterNode> nodes() {
    return Collections.unmodifiableCollection(nodes.values());
  }

  public int size() {
    return nodes.size();
  }

  public int maxDepth() {
    return nodes.values().stream().mapToInt(ClusterNode::getDepth).max().orElse(0);
  }
}
