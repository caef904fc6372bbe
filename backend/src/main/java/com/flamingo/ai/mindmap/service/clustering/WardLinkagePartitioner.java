package com.flamingo.ai.mindmap.service.clustering;

import com.flamingo.ai.mindmap.exception.ClusteringException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Agglomerative clustering with Ward linkage.
 *
 * <p>Starts from singleton clusters and repeatedly merges the pair whose union increases the total
 * within-cluster variance the least, using the Lance-Williams update on squared Euclidean distances,
 * until the requested number of clusters remains. Ties go to the lowest {@code (i, j)} slot pair. The
 * resulting groups are labelled by ascending smallest member index.
 */
@Slf4j
@Component
public class WardLinkagePartitioner implements ClusterPartitioner {

  @Override
  public int[] partition(double[][] points, int groups) {
    int n = points == null ? 0 : points.length;
    if (n < 2) {
      throw new ClusteringException("Need at least two samples to partition, got " + n);
    }
    if (groups < 2 || groups > n) {
      throw new ClusteringException("Cannot split " + n + " samples into " + groups + " groups");
    }
    validate(points);

    double[][] distance = new double[n][n];
    for (int i = 0; i < n; i++) {
      for (int j = i + 1; j < n; j++) {
        double d = squaredDistance(points[i], points[j]);
        distance[i][j] = d;
        distance[j][i] = d;
      }
    }

    // Slot i holds the members of the cluster that currently lives there
    List<List<Integer>> members = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      List<Integer> singleton = new ArrayList<>();
      singleton.add(i);
      members.add(singleton);
    }
    boolean[] active = new boolean[n];
    Arrays.fill(active, true);

    for (int remaining = n; remaining > groups; remaining--) {
      int bestI = -1;
      int bestJ = -1;
      double best = Double.POSITIVE_INFINITY;
      for (int i = 0; i < n; i++) {
        if (!active[i]) {
          continue;
        }
        for (int j = i + 1; j < n; j++) {
          if (active[j] && distance[i][j] < best) {
            best = distance[i][j];
            bestI = i;
            bestJ = j;
          }
        }
      }
      merge(distance, members, active, bestI, bestJ);
    }

    List<List<Integer>> clusters = new ArrayList<>(groups);
    for (int i = 0; i < n; i++) {
      if (active[i]) {
        clusters.add(members.get(i));
      }
    }
    clusters.sort(Comparator.comparingInt(WardLinkagePartitioner::smallestMember));

    int[] labels = new int[n];
    for (int label = 0; label < clusters.size(); label++) {
      for (int index : clusters.get(label)) {
        labels[index] = label;
      }
    }
    log.debug("Partitioned {} samples into {} groups", n, clusters.size());
    return labels;
  }

  private static void merge(
      double[][] distance, List<List<Integer>> members, boolean[] active, int i, int j) {
    double sizeI = members.get(i).size();
    double sizeJ = members.get(j).size();
    double dij = distance[i][j];
    for (int k = 0; k < active.length; k++) {
      if (!active[k] || k == i || k == j) {
        continue;
      }
      double sizeK = members.get(k).size();
      double updated =
          ((sizeI + sizeK) * distance[i][k] + (sizeJ + sizeK) * distance[j][k] - sizeK * dij)
              / (sizeI + sizeJ + sizeK);
      distance[i][k] = updated;
      distance[k][i] = updated;
    }
    members.get(i).addAll(members.get(j));
    members.get(j).clear();
    active[j] = false;
  }

  private static int smallestMember(List<Integer> cluster) {
    return cluster.stream().mapToInt(Integer::intValue).min().orElseThrow();
  }

  private static void validate(double[][] points) {
    int dimension = points[0].length;
    boolean allIdentical = true;
    for (double[] point : points) {
      if (point.length != dimension) {
        throw new ClusteringException("Points have inconsistent dimensionality");
      }
      for (double value : point) {
        if (!Double.isFinite(value)) {
          throw new ClusteringException("Points contain non-finite values");
        }
      }
      if (allIdentical && !Arrays.equals(point, points[0])) {
        allIdentical = false;
      }
    }
    if (allIdentical) {
      throw new ClusteringException("All " + points.length + " points are identical");
    }
  }

  private static double squaredDistance(double[] a, double[] b) {
    double sum = 0.0;
    for (int i = 0; i < a.length; i++) {
      double diff = a[i] - b[i];
      sum += diff * diff;
    }
    return sum;
  }
}
