package com.flamingo.ai.mindmap.service.clustering;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.mindmap.config.MindmapConfig;
import com.flamingo.ai.mindmap.domain.enums.LeafReason;
import com.flamingo.ai.mindmap.domain.model.ClusterNode;
import com.flamingo.ai.mindmap.domain.model.ClusterTree;
import com.flamingo.ai.mindmap.domain.model.TextSegment;
import com.flamingo.ai.mindmap.exception.InvalidInputException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RecursiveTreeBuilderTest {

  private SimpleMeterRegistry meterRegistry;
  private RecursiveTreeBuilder builder;

  @BeforeEach
  void setUp() {
    MindmapConfig config = new MindmapConfig();
    meterRegistry = new SimpleMeterRegistry();
    builder =
        new RecursiveTreeBuilder(
            new AdaptiveParameterPolicy(config),
            new TruncatedSvdReducer(),
            new WardLinkagePartitioner(),
            config,
            meterRegistry);
  }

  @Test
  @DisplayName("should split three segments into two children at the root")
  void shouldSplitThreeSegmentsIntoTwoChildren() {
    List<float[]> embeddings =
        List.of(new float[] {1.0f, 0.0f}, new float[] {0.9f, 0.1f}, new float[] {0.0f, 1.0f});

    ClusterTree tree = builder.build(segments(3), embeddings, 3, 2);

    ClusterNode root = tree.getRoot();
    assertThat(root.isLeaf()).isFalse();
    List<ClusterNode> children = tree.children(root);
    assertThat(children).hasSize(2);
    assertThat(children.get(0).getId()).isEqualTo("root_0");
    assertThat(children.get(0).getMemberIndices()).containsExactly(0, 1);
    assertThat(children.get(1).getId()).isEqualTo("root_1");
    assertThat(children.get(1).getMemberIndices()).containsExactly(2);
  }

  @Test
  @DisplayName("should return a single leaf for a single segment")
  void shouldReturnSingleLeaf_whenOneSegment() {
    ClusterTree tree = builder.build(segments(1), List.of(new float[] {0.3f, 0.7f}), 3, 2);

    assertThat(tree.size()).isEqualTo(1);
    ClusterNode root = tree.getRoot();
    assertThat(root.isLeaf()).isTrue();
    assertThat(root.getMemberIndices()).containsExactly(0);
    assertThat(root.getChildIds()).isEmpty();
    assertThat(root.getLeafReason()).isEqualTo(LeafReason.BELOW_MIN_SIZE);
  }

  @Test
  @DisplayName("should return a single leaf for a single segment even with min size 1")
  void shouldReturnSingleLeaf_whenOneSegmentAndMinSizeOne() {
    ClusterTree tree = builder.build(segments(1), List.of(new float[] {0.3f, 0.7f}), 5, 1);

    assertThat(tree.size()).isEqualTo(1);
    assertThat(tree.getRoot().getMemberIndices()).containsExactly(0);
    assertThat(tree.getRoot().getLeafReason()).isEqualTo(LeafReason.DEGENERATE);
  }

  @Test
  @DisplayName("should turn duplicate-only input into a degenerate leaf")
  void shouldCreateDegenerateLeaf_whenAllEmbeddingsIdentical() {
    List<float[]> embeddings = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      embeddings.add(new float[] {0.5f, 0.5f, 0.1f});
    }

    ClusterTree tree = builder.build(segments(4), embeddings, 3, 2);

    assertThat(tree.size()).isEqualTo(1);
    assertThat(tree.getRoot().getLeafReason()).isEqualTo(LeafReason.DEGENERATE);
    assertThat(tree.getRoot().getMemberIndices()).containsExactly(0, 1, 2, 3);
    assertThat(meterRegistry.counter("clustering.degenerate").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should partition members, increment depth and stop leaves correctly")
  void shouldSatisfyStructuralProperties() {
    int n = 40;
    ClusterTree tree = builder.build(segments(n), randomEmbeddings(n, 8, 7L), 3, 2);

    ClusterNode root = tree.getRoot();
    assertThat(root.getDepth()).isZero();
    assertThat(root.getMemberIndices()).hasSize(n);
    assertThat(tree.size()).isGreaterThan(1);

    for (ClusterNode node : tree.preOrder()) {
      if (node.isLeaf()) {
        assertThat(node.getLeafReason()).isNotEqualTo(LeafReason.DEGENERATE);
        boolean stops =
            node.size() < node.getLimits().minSize()
                || node.getDepth() >= node.getLimits().maxDepth();
        assertThat(stops).as("leaf %s meets a stop condition", node.getId()).isTrue();
        continue;
      }
      Set<Integer> union = new HashSet<>();
      int total = 0;
      for (ClusterNode child : tree.children(node)) {
        assertThat(child.getDepth()).isEqualTo(node.getDepth() + 1);
        assertThat(child.getId()).startsWith(node.getId() + "_");
        union.addAll(child.getMemberIndices());
        total += child.size();
      }
      assertThat(total).as("children of %s do not overlap", node.getId()).isEqualTo(union.size());
      assertThat(union).containsExactlyInAnyOrderElementsOf(node.getMemberIndices());
    }
  }

  @Test
  @DisplayName("should use at most 2 + depth children per node")
  void shouldBoundChildCount() {
    ClusterTree tree = builder.build(segments(30), randomEmbeddings(30, 6, 11L), 3, 2);

    for (ClusterNode node : tree.nodes()) {
      if (!node.isLeaf()) {
        assertThat(node.getChildIds().size()).isBetween(2, 2 + node.getDepth());
      }
    }
  }

  @Test
  @DisplayName("should not go deeper than the base max depth")
  void shouldRespectMaxDepth() {
    ClusterTree tree = builder.build(segments(40), randomEmbeddings(40, 8, 3L), 1, 2);

    assertThat(tree.maxDepth()).isEqualTo(1);
    assertThat(tree.leaves())
        .allSatisfy(leaf -> assertThat(leaf.getDepth()).isEqualTo(1));
  }

  @Test
  @DisplayName("should build identical trees for identical input")
  void shouldBeDeterministic() {
    List<float[]> embeddings = randomEmbeddings(25, 5, 19L);

    ClusterTree first = builder.build(segments(25), embeddings, 3, 2);
    ClusterTree second = builder.build(segments(25), embeddings, 3, 2);

    assertThat(first.size()).isEqualTo(second.size());
    List<ClusterNode> firstNodes = first.preOrder();
    List<ClusterNode> secondNodes = second.preOrder();
    for (int i = 0; i < firstNodes.size(); i++) {
      assertThat(firstNodes.get(i).getId()).isEqualTo(secondNodes.get(i).getId());
      assertThat(firstNodes.get(i).getMemberIndices())
          .isEqualTo(secondNodes.get(i).getMemberIndices());
    }
  }

  @Test
  @DisplayName("should reject embeddings not aligned with segments")
  void shouldThrow_whenEmbeddingCountMismatch() {
    assertThatThrownBy(() -> builder.build(segments(3), List.of(new float[] {1.0f}), 3, 2))
        .isInstanceOf(InvalidInputException.class);
  }

  @Test
  @DisplayName("should reject embeddings of different dimensions")
  void shouldThrow_whenDimensionsDiffer() {
    List<float[]> embeddings = List.of(new float[] {1.0f, 0.0f}, new float[] {1.0f});

    assertThatThrownBy(() -> builder.build(segments(2), embeddings, 3, 2))
        .isInstanceOf(InvalidInputException.class);
  }

  static List<TextSegment> segments(int count) {
    List<TextSegment> segments = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      String text = "Segment number " + i + " about some topic";
      segments.add(new TextSegment(i, text, text));
    }
    return segments;
  }

  static List<float[]> randomEmbeddings(int count, int dimension, long seed) {
    Random random = new Random(seed);
    List<float[]> embeddings = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      float[] vector = new float[dimension];
      for (int d = 0; d < dimension; d++) {
        vector[d] = (float) random.nextGaussian();
      }
      embeddings.add(vector);
    }
    return embeddings;
  }
}
