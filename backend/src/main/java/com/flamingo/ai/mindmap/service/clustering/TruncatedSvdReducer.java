package com.flamingo.ai.mindmap.service.clustering;

import com.flamingo.ai.mindmap.exception.ClusteringException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Truncated singular value decomposition without centering, computed by power iteration on
 * {@code XᵀX} with Gram-Schmidt deflation. Rows are projected onto the leading right singular vectors,
 * which yields {@code U·Σ}.
 *
 * <p>The starting vectors come from a fixed seed and every singular vector is sign-normalized so its
 * largest-magnitude coordinate is positive, so identical input always gives identical output.
 */
@Slf4j
@Component
public class TruncatedSvdReducer implements DimensionalityReducer {

  static final long SEED = 42L;
  private static final int MAX_ITERATIONS = 200;
  private static final double TOLERANCE = 1e-9;
  private static final double ZERO = 1e-12;

  @Override
  public double[][] reduce(double[][] data, int components) {
    if (data == null || data.length == 0) {
      throw new ClusteringException("Cannot reduce an empty sample set");
    }
    int features = data[0].length;
    for (double[] row : data) {
      if (row.length != features) {
        throw new ClusteringException("Rows have inconsistent dimensionality");
      }
      for (double value : row) {
        if (!Double.isFinite(value)) {
          throw new ClusteringException("Embeddings contain non-finite values");
        }
      }
    }

    int target = Math.min(components, Math.min(features, data.length));
    if (target < 1) {
      throw new ClusteringException("No components to compute for " + data.length + " samples");
    }

    Random random = new Random(SEED);
    List<double[]> basis = new ArrayList<>(target);
    double leadingSigma = 0.0;

    for (int c = 0; c < target; c++) {
      double[] v = startVector(random, features, basis);
      if (v == null) {
        break;
      }
      v = powerIterate(data, v, basis);
      if (v == null) {
        break;
      }
      double sigma = norm(multiply(data, v));
      if (sigma <= ZERO * Math.max(1.0, leadingSigma)) {
        break;
      }
      if (basis.isEmpty()) {
        leadingSigma = sigma;
      }
      flipSign(v);
      basis.add(v);
    }

    if (basis.isEmpty()) {
      throw new ClusteringException("Input has no non-zero singular value");
    }
    log.debug(
        "Reduced {} samples from {} to {} components (requested {})",
        data.length,
        features,
        basis.size(),
        components);

    double[][] projected = new double[data.length][basis.size()];
    for (int i = 0; i < data.length; i++) {
      for (int j = 0; j < basis.size(); j++) {
        projected[i][j] = dot(data[i], basis.get(j));
      }
    }
    return projected;
  }

  private double[] startVector(Random random, int features, List<double[]> basis) {
    double[] v = new double[features];
    for (int i = 0; i < features; i++) {
      v[i] = random.nextGaussian();
    }
    orthogonalize(v, basis);
    double length = norm(v);
    if (length <= ZERO) {
      return null;
    }
    scale(v, 1.0 / length);
    return v;
  }

  /** Returns the converged unit vector, or null when the remaining spectrum is zero. */
  private double[] powerIterate(double[][] data, double[] start, List<double[]> basis) {
    double[] v = start;
    for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
      double[] w = multiplyTransposed(data, multiply(data, v));
      orthogonalize(w, basis);
      double length = norm(w);
      if (length <= ZERO) {
        return null;
      }
      scale(w, 1.0 / length);
      double delta = 0.0;
      for (int i = 0; i < w.length; i++) {
        double diff = w[i] - v[i];
        delta += diff * diff;
      }
      v = w;
      if (Math.sqrt(delta) < TOLERANCE) {
        break;
      }
    }
    return v;
  }

  // X v
  private static double[] multiply(double[][] data, double[] v) {
    double[] result = new double[data.length];
    for (int i = 0; i < data.length; i++) {
      result[i] = dot(data[i], v);
    }
    return result;
  }

  // Xᵀ u
  private static double[] multiplyTransposed(double[][] data, double[] u) {
    double[] result = new double[data[0].length];
    for (int i = 0; i < data.length; i++) {
      double weight = u[i];
      if (weight == 0.0) {
        continue;
      }
      double[] row = data[i];
      for (int j = 0; j < row.length; j++) {
        result[j] += weight * row[j];
      }
    }
    return result;
  }

  private static void orthogonalize(double[] v, List<double[]> basis) {
    for (double[] b : basis) {
      double projection = dot(v, b);
      for (int i = 0; i < v.length; i++) {
        v[i] -= projection * b[i];
      }
    }
  }

  private static void flipSign(double[] v) {
    int largest = 0;
    for (int i = 1; i < v.length; i++) {
      if (Math.abs(v[i]) > Math.abs(v[largest])) {
        largest = i;
      }
    }
    if (v[largest] < 0) {
      scale(v, -1.0);
    }
  }

  private static double dot(double[] a, double[] b) {
    double sum = 0.0;
    for (int i = 0; i < a.length; i++) {
      sum += a[i] * b[i];
    }
    return sum;
  }

  private static double norm(double[] v) {
    return Math.sqrt(dot(v, v));
  }

  private static void scale(double[] v, double factor) {
    for (int i = 0; i < v.length; i++) {
      v[i] *= factor;
    }
  }
}
