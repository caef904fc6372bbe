package com.flamingo.ai.mindmap.service.clustering;

import com.flamingo.ai.mindmap.config.MindmapConfig;
import com.flamingo.ai.mindmap.domain.model.ClusterLimits;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Computes the depth ceiling and minimum group size for a subtree.
 *
 * <p>The depth ceiling shrinks by one for every two levels of depth, so deeper subtrees are allowed
 * fewer further splits. The minimum size grows with the subtree's sample count so that large subtrees
 * do not fragment into tiny groups.
 */
@Component
@RequiredArgsConstructor
public class AdaptiveParameterPolicy {

  private final MindmapConfig mindmapConfig;

  /**
   * Computes the limits in effect for a subtree.
   *
   * @param sampleCount number of segments in the subtree
   * @param currentDepth depth of the subtree's root
   * @param baseMaxDepth configured or requested depth ceiling
   * @param baseMinSize configured or requested minimum group size
   * @return limits, never below 1 for either value
   */
  public ClusterLimits computeLimits(
      int sampleCount, int currentDepth, int baseMaxDepth, int baseMinSize) {
    int maxDepth = Math.max(1, baseMaxDepth - currentDepth / 2);
    double ratio = mindmapConfig.getClustering().getMinClusterSizeRatio();
    int proportional = (int) Math.ceil(sampleCount * ratio);
    int minSize = Math.max(1, Math.max(baseMinSize, proportional));
    return new ClusterLimits(maxDepth, minSize);
  }
}
