package com.flamingo.ai.mindmap.service.clustering;

/** Projects high-dimensional vectors onto a smaller number of components. */
public interface DimensionalityReducer {

  /**
   * Reduces the rows of {@code data}.
   *
   * @param data one row per sample, all rows of equal length
   * @param components requested number of output components
   * @return one row per sample with at most {@code components} columns
   * @throws com.flamingo.ai.mindmap.exception.ClusteringException when no usable component exists
   */
  double[][] reduce(double[][] data, int components);
}
