package com.flamingo.ai.mindmap.service.clustering;

import com.flamingo.ai.mindmap.config.MindmapConfig;
import com.flamingo.ai.mindmap.domain.enums.LeafReason;
import com.flamingo.ai.mindmap.domain.model.ClusterLimits;
import com.flamingo.ai.mindmap.domain.model.ClusterNode;
import com.flamingo.ai.mindmap.domain.model.ClusterTree;
import com.flamingo.ai.mindmap.domain.model.TextSegment;
import com.flamingo.ai.mindmap.exception.ClusteringException;
import com.flamingo.ai.mindmap.exception.InvalidInputException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds the unlabeled topic tree by recursively splitting segments on their embeddings.
 *
 * <p>Each subtree is reduced with the {@link DimensionalityReducer}, split into {@code 2 + depth}
 * groups (bounded by its size) with the {@link ClusterPartitioner}, and every group becomes a child.
 * Recursion stops when a subtree falls below the minimum size or reaches the depth ceiling computed
 * by the {@link AdaptiveParameterPolicy}. A subtree that cannot be split becomes a leaf.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecursiveTreeBuilder {

  private final AdaptiveParameterPolicy parameterPolicy;
  private final DimensionalityReducer dimensionalityReducer;
  private final ClusterPartitioner clusterPartitioner;
  private final MindmapConfig mindmapConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Builds the tree for a whole document.
   *
   * @param segments cleaned segments, indexed from 0
   * @param embeddings one vector per segment, same order
   * @param baseMaxDepth depth ceiling before adaptation
   * @param baseMinSize minimum group size before adaptation
   * @return the tree, rooted at {@link ClusterTree#ROOT_ID}
   */
  public ClusterTree build(
      List<TextSegment> segments, List<float[]> embeddings, int baseMaxDepth, int baseMinSize) {
    if (segments == null || segments.isEmpty()) {
      throw new InvalidInputException("Cannot build a mindmap without segments");
    }
    if (embeddings == null || embeddings.size() != segments.size()) {
      throw new InvalidInputException(
          "Expected "
              + segments.size()
              + " embeddings, got "
              + (embeddings == null ? 0 : embeddings.size()));
    }
    int dimension = embeddings.get(0).length;
    for (float[] vector : embeddings) {
      if (vector.length != dimension) {
        throw new InvalidInputException("Embeddings have inconsistent dimensionality");
      }
    }

    List<Integer> allIndices = new ArrayList<>(segments.size());
    for (int i = 0; i < segments.size(); i++) {
      allIndices.add(i);
    }

    BuildContext context =
        new BuildContext(new ClusterTree(), embeddings, baseMaxDepth, baseMinSize);
    ClusterLimits rootLimits =
        parameterPolicy.computeLimits(segments.size(), 0, baseMaxDepth, baseMinSize);
    buildNode(context, null, allIndices, 0, ClusterTree.ROOT_ID, rootLimits);

    log.info(
        "Built cluster tree: {} nodes, {} leaves, max depth {} from {} segments",
        context.tree().size(),
        context.tree().leaves().size(),
        context.tree().maxDepth(),
        segments.size());
    return context.tree();
  }

  private void buildNode(
      BuildContext context,
      String parentId,
      List<Integer> members,
      int depth,
      String clusterId,
      ClusterLimits limits) {
    int n = members.size();
    if (n < limits.minSize()) {
      addLeaf(context, parentId, clusterId, depth, members, limits, LeafReason.BELOW_MIN_SIZE);
      return;
    }
    if (depth >= limits.maxDepth()) {
      addLeaf(context, parentId, clusterId, depth, members, limits, LeafReason.MAX_DEPTH_REACHED);
      return;
    }

    Map<Integer, List<Integer>> groups;
    try {
      groups = split(context, members, depth);
    } catch (ClusteringException e) {
      log.warn("Cluster '{}' with {} members cannot be split: {}", clusterId, n, e.getMessage());
      meterRegistry.counter("clustering.degenerate").increment();
      addLeaf(context, parentId, clusterId, depth, members, limits, LeafReason.DEGENERATE);
      return;
    }

    List<String> childIds = new ArrayList<>(groups.size());
    for (Integer label : groups.keySet()) {
      childIds.add(clusterId + "_" + label);
    }
    context
        .tree()
        .add(ClusterNode.internal(clusterId, depth, members, childIds, limits), parentId);
    log.debug("Cluster '{}' at depth {} split {} members into {}", clusterId, depth, n, childIds);

    ClusterLimits childLimits =
        parameterPolicy.computeLimits(n, depth, context.baseMaxDepth(), context.baseMinSize());
    for (Map.Entry<Integer, List<Integer>> group : groups.entrySet()) {
      buildNode(
          context,
          clusterId,
          group.getValue(),
          depth + 1,
          clusterId + "_" + group.getKey(),
          childLimits);
    }
  }

  /** Returns member indices per group label, in ascending label order. */
  private Map<Integer, List<Integer>> split(
      BuildContext context, List<Integer> members, int depth) {
    int n = members.size();
    if (n < 2) {
      throw new ClusteringException("Need at least two samples, got " + n);
    }
    double[][] data = new double[n][];
    for (int row = 0; row < n; row++) {
      float[] vector = context.embeddings().get(members.get(row));
      double[] values = new double[vector.length];
      for (int col = 0; col < vector.length; col++) {
        values[col] = vector[col];
      }
      data[row] = values;
    }

    int components =
        Math.min(mindmapConfig.getClustering().getSvdComponents(), Math.min(data[0].length, n));
    double[][] reduced = dimensionalityReducer.reduce(data, components);

    int groupCount = Math.max(2, Math.min(2 + depth, n));
    int[] labels = clusterPartitioner.partition(reduced, groupCount);

    Map<Integer, List<Integer>> groups = new TreeMap<>();
    for (int row = 0; row < n; row++) {
      groups.computeIfAbsent(labels[row], k -> new ArrayList<>()).add(members.get(row));
    }
    if (groups.size() < 2) {
      throw new ClusteringException("Partition produced a single group");
    }
    return groups;
  }

  private void addLeaf(
      BuildContext context,
      String parentId,
      String clusterId,
      int depth,
      List<Integer> members,
      ClusterLimits limits,
      LeafReason reason) {
    context.tree().add(ClusterNode.leaf(clusterId, depth, members, limits, reason), parentId);
    log.debug(
        "Leaf '{}' at depth {} with {} members ({}, limits {})",
        clusterId,
        depth,
        members.size(),
        reason,
        limits);
  }

  private record BuildContext(
      ClusterTree tree, List<float[]> embeddings, int baseMaxDepth, int baseMinSize) {}
}
