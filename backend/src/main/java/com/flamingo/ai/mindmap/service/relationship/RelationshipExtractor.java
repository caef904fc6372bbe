package com.flamingo.ai.mindmap.service.relationship;

import com.flamingo.ai.mindmap.config.MindmapConfig;
import com.flamingo.ai.mindmap.domain.enums.RelationshipKind;
import com.flamingo.ai.mindmap.domain.model.ClusterNode;
import com.flamingo.ai.mindmap.domain.model.ClusterTree;
import com.flamingo.ai.mindmap.domain.model.Relationship;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Links semantically close segments inside each leaf cluster.
 *
 * <p>For every member of a leaf, the other members whose cosine similarity to it reaches the
 * threshold are ranked by similarity and the strongest few become directed relationships. Similarity
 * is computed on the original embeddings, not the reduced ones used for clustering.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RelationshipExtractor {

  private final MindmapConfig mindmapConfig;

  /**
   * Sets the relationships of every leaf and summarizes them.
   *
   * @param tree tree whose leaves receive relationships
   * @param embeddings original embeddings, indexed like the segments
   * @return the summary
   */
  public RelationshipSummary extract(ClusterTree tree, List<float[]> embeddings) {
    double threshold = mindmapConfig.getRelationships().getSimilarityThreshold();
    int maxPerConcept = mindmapConfig.getRelationships().getMaxPerConcept();

    List<RelationshipStats> stats = new ArrayList<>();
    List<Relationship> all = new ArrayList<>();
    for (ClusterNode leaf : tree.leaves()) {
      List<Relationship> relationships =
          extractForCluster(leaf.getMemberIndices(), embeddings, threshold, maxPerConcept);
      leaf.setRelationships(relationships);
      stats.add(RelationshipStats.of(leaf.getId(), leaf.size(), relationships.size()));
      all.addAll(relationships);
      if (!relationships.isEmpty()) {
        log.debug(
            "Leaf '{}': {} relationships from {} concepts",
            leaf.getId(),
            relationships.size(),
            leaf.size());
      }
    }

    RelationshipSummary summary = summarize(all, stats, threshold);
    log.info(
        "Extracted {} relationships across {} leaves (threshold {})",
        summary.totalRelationships(),
        stats.size(),
        threshold);
    return summary;
  }

  /**
   * Extracts relationships among one cluster's members.
   *
   * @param members global segment indices of the cluster
   * @param embeddings original embeddings
   * @param threshold minimum cosine similarity
   * @param maxPerConcept maximum relationships per source segment
   * @return relationships grouped by source in member order, strongest first
   */
  public List<Relationship> extractForCluster(
      List<Integer> members, List<float[]> embeddings, double threshold, int maxPerConcept) {
    int m = members.size();
    if (m < 2 || maxPerConcept < 1) {
      return List.of();
    }
    double[][] similarity = new double[m][m];
    for (int i = 0; i < m; i++) {
      for (int j = i + 1; j < m; j++) {
        double value =
            cosineSimilarity(embeddings.get(members.get(i)), embeddings.get(members.get(j)));
        similarity[i][j] = value;
        similarity[j][i] = value;
      }
    }

    List<Relationship> relationships = new ArrayList<>();
    for (int i = 0; i < m; i++) {
      List<Integer> candidates = new ArrayList<>();
      for (int j = 0; j < m; j++) {
        if (i != j && similarity[i][j] >= threshold) {
          candidates.add(j);
        }
      }
      final double[] row = similarity[i];
      candidates.sort(
          Comparator.comparingDouble((Integer j) -> row[j])
              .reversed()
              .thenComparing(j -> members.get(j)));
      for (int j : candidates.subList(0, Math.min(maxPerConcept, candidates.size()))) {
        double confidence = Math.max(0.0, Math.min(1.0, row[j]));
        relationships.add(
            new Relationship(
                members.get(i), members.get(j), confidence, RelationshipKind.SEMANTIC_SIMILARITY));
      }
    }
    return relationships;
  }

  /** Cosine similarity, or NaN when either vector has zero norm; NaN never reaches a threshold. */
  static double cosineSimilarity(float[] a, float[] b) {
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      normA += (double) a[i] * a[i];
      normB += (double) b[i] * b[i];
    }
    if (normA == 0.0 || normB == 0.0) {
      return Double.NaN;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }

  private static RelationshipSummary summarize(
      List<Relationship> all, List<RelationshipStats> stats, double threshold) {
    if (all.isEmpty()) {
      return new RelationshipSummary(0, 0.0, null, null, 0.0, threshold, stats);
    }
    Relationship strongest = all.get(0);
    Relationship weakest = all.get(0);
    double total = 0.0;
    for (Relationship relationship : all) {
      if (relationship.confidence() > strongest.confidence()) {
        strongest = relationship;
      }
      if (relationship.confidence() < weakest.confidence()) {
        weakest = relationship;
      }
      total += relationship.confidence();
    }
    return new RelationshipSummary(
        all.size(),
        stats.isEmpty() ? 0.0 : (double) all.size() / stats.size(),
        strongest,
        weakest,
        total / all.size(),
        threshold,
        stats);
  }
}
