package com.flamingo.ai.mindmap.service.clustering;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.mindmap.exception.ClusteringException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TruncatedSvdReducerTest {

  private final TruncatedSvdReducer reducer = new TruncatedSvdReducer();

  @Test
  @DisplayName("should return one row per sample with the requested components")
  void shouldReduceToRequestedComponents() {
    double[][] data = {
      {1.0, 0.0, 2.0}, {0.0, 1.0, 0.5}, {3.0, 1.0, 0.0}, {1.0, 4.0, 1.0}
    };

    double[][] reduced = reducer.reduce(data, 2);

    assertThat(reduced).hasNumberOfRows(4);
    for (double[] row : reduced) {
      assertThat(row).hasSize(2);
    }
  }

  @Test
  @DisplayName("should cap components at the rank of the input")
  void shouldCapComponents_whenInputIsRankDeficient() {
    double[][] data = {{1.0, 1.0}, {2.0, 2.0}, {3.0, 3.0}};

    double[][] reduced = reducer.reduce(data, 50);

    assertThat(reduced[0]).hasSize(1);
    assertThat(reduced[0][0]).isCloseTo(Math.sqrt(2.0), within(1e-9));
    assertThat(reduced[1][0]).isCloseTo(2 * Math.sqrt(2.0), within(1e-9));
    assertThat(reduced[2][0]).isCloseTo(3 * Math.sqrt(2.0), within(1e-9));
  }

  @Test
  @DisplayName("should preserve pairwise distances when keeping full rank")
  void shouldPreserveDistances_whenFullRank() {
    double[][] data = {{1.0, 0.0}, {0.0, 2.0}, {3.0, 1.0}};

    double[][] reduced = reducer.reduce(data, 2);

    for (int i = 0; i < data.length; i++) {
      for (int j = i + 1; j < data.length; j++) {
        assertThat(distance(reduced[i], reduced[j]))
            .isCloseTo(distance(data[i], data[j]), within(1e-6));
      }
    }
  }

  @Test
  @DisplayName("should produce identical output on repeated calls")
  void shouldBeDeterministic() {
    double[][] data = {
      {0.3, 0.1, 0.9, 0.2}, {0.8, 0.7, 0.1, 0.4}, {0.2, 0.9, 0.5, 0.6}, {0.5, 0.5, 0.5, 0.1}
    };

    assertThat(reducer.reduce(data, 3)).isDeepEqualTo(reducer.reduce(data, 3));
  }

  @Test
  @DisplayName("should reject all-zero input")
  void shouldThrow_whenAllZero() {
    double[][] data = {{0.0, 0.0}, {0.0, 0.0}};

    assertThatThrownBy(() -> reducer.reduce(data, 2)).isInstanceOf(ClusteringException.class);
  }

  @Test
  @DisplayName("should reject non-finite values")
  void shouldThrow_whenNonFinite() {
    double[][] data = {{1.0, Double.NaN}, {0.0, 1.0}};

    assertThatThrownBy(() -> reducer.reduce(data, 2))
        .isInstanceOf(ClusteringException.class)
        .hasMessageContaining("non-finite");
  }

  private static double distance(double[] a, double[] b) {
    double sum = 0.0;
    for (int i = 0; i < a.length; i++) {
      sum += (a[i] - b[i]) * (a[i] - b[i]);
    }
    return Math.sqrt(sum);
  }
}
