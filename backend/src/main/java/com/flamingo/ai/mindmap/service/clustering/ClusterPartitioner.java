package com.flamingo.ai.mindmap.service.clustering;

/** Splits a set of points into a fixed number of groups. */
public interface ClusterPartitioner {

  /**
   * Assigns every point to one of {@code groups} groups.
   *
   * @param points one row per sample
   * @param groups number of groups, between 2 and the number of points
   * @return group label per point, labels numbered from 0 and all in use
   * @throws com.flamingo.ai.mindmap.exception.ClusteringException for degenerate input
   */
  int[] partition(double[][] points, int groups);
}
