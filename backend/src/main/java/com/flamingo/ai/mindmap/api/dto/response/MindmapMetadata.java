package com.flamingo.ai.mindmap.api.dto.response;

import com.flamingo.ai.mindmap.domain.model.ClusterTree;
import com.flamingo.ai.mindmap.service.mindmap.MindmapResult;
import com.flamingo.ai.mindmap.service.relationship.RelationshipStats;
import com.flamingo.ai.mindmap.service.relationship.RelationshipSummary;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO with statistics about a generated mindmap. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MindmapMetadata {

  private int segmentCount;
  private int nodeCount;
  private int leafCount;
  private int depthReached;
  private int maxDepth;
  private int minSize;
  private int relationshipCount;
  private double averageRelationshipsPerCluster;
  private double averageConfidence;
  private double similarityThreshold;
  private Map<String, Double> relationshipDensity;
  private boolean titleFallback;

  /** Creates metadata from a pipeline result. */
  public static MindmapMetadata fromResult(MindmapResult result) {
    ClusterTree tree = result.tree();
    RelationshipSummary relationships = result.relationships();
    Map<String, Double> density = new LinkedHashMap<>();
    for (RelationshipStats stats : relationships.clusters()) {
      density.put(stats.clusterId(), stats.density());
    }
    return MindmapMetadata.builder()
        .segmentCount(result.segments().size())
        .nodeCount(tree.size())
        .leafCount(tree.leaves().size())
        .depthReached(tree.maxDepth())
        .maxDepth(result.parameters().maxDepth())
        .minSize(result.parameters().minSize())
        .relationshipCount(relationships.totalRelationships())
        .averageRelationshipsPerCluster(relationships.averagePerCluster())
        .averageConfidence(relationships.averageConfidence())
        .similarityThreshold(relationships.similarityThreshold())
        .relationshipDensity(density)
        .titleFallback(result.rootSummary().fallback())
        .build();
  }
}
