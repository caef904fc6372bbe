package com.flamingo.ai.mindmap.service.relationship;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.mindmap.config.MindmapConfig;
import com.flamingo.ai.mindmap.domain.enums.LeafReason;
import com.flamingo.ai.mindmap.domain.enums.RelationshipKind;
import com.flamingo.ai.mindmap.domain.model.ClusterLimits;
import com.flamingo.ai.mindmap.domain.model.ClusterNode;
import com.flamingo.ai.mindmap.domain.model.ClusterTree;
import com.flamingo.ai.mindmap.domain.model.Relationship;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RelationshipExtractorTest {

  private static final ClusterLimits LIMITS = new ClusterLimits(1, 2);

  private RelationshipExtractor extractor;

  @BeforeEach
  void setUp() {
    extractor = new RelationshipExtractor(new MindmapConfig());
  }

  @Nested
  @DisplayName("extractForCluster")
  class ExtractForCluster {

    @Test
    @DisplayName("should link only pairs at or above the threshold")
    void shouldLinkSimilarPairs() {
      List<float[]> embeddings =
          List.of(new float[] {1f, 0f}, new float[] {1f, 0.1f}, new float[] {0f, 1f});

      List<Relationship> relationships =
          extractor.extractForCluster(List.of(0, 1, 2), embeddings, 0.7, 5);

      assertThat(relationships)
          .extracting(Relationship::sourceIndex, Relationship::targetIndex)
          .containsExactly(tuple(0, 1), tuple(1, 0));
      assertThat(relationships.get(0).confidence()).isCloseTo(0.995, within(0.001));
      assertThat(relationships.get(0).kind()).isEqualTo(RelationshipKind.SEMANTIC_SIMILARITY);
    }

    @Test
    @DisplayName("should cap relationships per source and break ties by target index")
    void shouldCapPerSource() {
      List<float[]> embeddings = new ArrayList<>();
      List<Integer> members = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        embeddings.add(new float[] {0.6f, 0.8f});
        members.add(i);
      }

      List<Relationship> relationships = extractor.extractForCluster(members, embeddings, 0.7, 5);

      assertThat(relationships).hasSize(8 * 5);
      assertThat(relationships.subList(0, 5))
          .extracting(Relationship::targetIndex)
          .containsExactly(1, 2, 3, 4, 5);
      assertThat(relationships)
          .allSatisfy(r -> assertThat(r.confidence()).isBetween(0.0, 1.0));
    }

    @Test
    @DisplayName("should order targets by descending similarity")
    void shouldOrderBySimilarity() {
      List<float[]> embeddings =
          List.of(
              new float[] {1f, 0f},
              new float[] {0.8f, 0.6f},
              new float[] {0.99f, 0.14f},
              new float[] {0.9f, 0.43f});

      List<Relationship> relationships =
          extractor.extractForCluster(List.of(0, 1, 2, 3), embeddings, 0.7, 5);

      assertThat(relationships.stream().filter(r -> r.sourceIndex() == 0))
          .extracting(Relationship::targetIndex)
          .containsExactly(2, 3, 1);
    }

    @Test
    @DisplayName("should treat zero vectors as unrelated even at threshold zero")
    void shouldIgnoreZeroVectors() {
      List<float[]> embeddings =
          List.of(new float[] {0f, 0f}, new float[] {0f, 0f}, new float[] {1f, 0f});

      assertThat(extractor.extractForCluster(List.of(0, 1, 2), embeddings, 0.0, 5)).isEmpty();
    }

    @Test
    @DisplayName("should return nothing for singleton clusters")
    void shouldReturnEmpty_whenSingleton() {
      assertThat(extractor.extractForCluster(List.of(0), List.of(new float[] {1f}), 0.0, 5))
          .isEmpty();
    }

    @Test
    @DisplayName("should use global segment indices")
    void shouldUseGlobalIndices() {
      List<float[]> embeddings =
          List.of(
              new float[] {0f, 1f},
              new float[] {0f, 1f},
              new float[] {1f, 0f},
              new float[] {1f, 0.05f});

      List<Relationship> relationships =
          extractor.extractForCluster(List.of(2, 3), embeddings, 0.7, 5);

      assertThat(relationships).extracting(Relationship::sourceIndex).containsExactly(2, 3);
    }
  }

  @Test
  @DisplayName("should set relationships on leaves only and summarize them")
  void shouldExtractForTree() {
    ClusterTree tree = new ClusterTree();
    tree.add(
        ClusterNode.internal("root", 0, List.of(0, 1, 2, 3, 4), List.of("root_0", "root_1"),
            new ClusterLimits(2, 2)),
        null);
    tree.add(
        ClusterNode.leaf("root_0", 1, List.of(0, 1, 2), LIMITS, LeafReason.MAX_DEPTH_REACHED),
        "root");
    tree.add(
        ClusterNode.leaf("root_1", 1, List.of(3, 4), LIMITS, LeafReason.MAX_DEPTH_REACHED),
        "root");
    List<float[]> embeddings =
        List.of(
            new float[] {1f, 0f},
            new float[] {1f, 0.1f},
            new float[] {1f, -0.1f},
            new float[] {0f, 1f},
            new float[] {1f, 0f});

    RelationshipSummary summary = extractor.extract(tree, embeddings);

    assertThat(tree.getRoot().getRelationships()).isEmpty();
    assertThat(tree.get("root_0").getRelationships()).hasSize(6);
    assertThat(tree.get("root_1").getRelationships()).isEmpty();
    assertThat(summary.totalRelationships()).isEqualTo(6);
    assertThat(summary.averagePerCluster()).isEqualTo(3.0);
    assertThat(summary.similarityThreshold()).isEqualTo(0.7);
    assertThat(summary.strongest().confidence())
        .isGreaterThanOrEqualTo(summary.weakest().confidence());
    assertThat(summary.clusters())
        .extracting(RelationshipStats::clusterId, RelationshipStats::density)
        .containsExactly(tuple("root_0", 1.0), tuple("root_1", 0.0));
  }

  @Test
  @DisplayName("should report an empty summary when no pair is similar")
  void shouldSummarizeEmpty() {
    ClusterTree tree = new ClusterTree();
    tree.add(
        ClusterNode.leaf("root", 0, List.of(0, 1), LIMITS, LeafReason.BELOW_MIN_SIZE), null);

    RelationshipSummary summary =
        extractor.extract(tree, List.of(new float[] {1f, 0f}, new float[] {0f, 1f}));

    assertThat(summary.totalRelationships()).isZero();
    assertThat(summary.strongest()).isNull();
    assertThat(summary.averageConfidence()).isZero();
  }

  @Test
  @DisplayName("should compute cosine similarity of known vectors")
  void shouldComputeCosine() {
    assertThat(
            RelationshipExtractor.cosineSimilarity(new float[] {1f, 0f}, new float[] {0f, 1f}))
        .isZero();
    assertThat(
            RelationshipExtractor.cosineSimilarity(new float[] {1f, 1f}, new float[] {2f, 2f}))
        .isCloseTo(1.0, within(1e-9));
    assertThat(
            RelationshipExtractor.cosineSimilarity(new float[] {1f, 0f}, new float[] {-1f, 0f}))
        .isCloseTo(-1.0, within(1e-9));
    assertThat(RelationshipExtractor.cosineSimilarity(new float[] {0f, 0f}, new float[] {1f, 0f}))
        .isNaN();
  }
}
