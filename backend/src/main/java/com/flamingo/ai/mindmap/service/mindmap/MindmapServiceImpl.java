package com.flamingo.ai.mindmap.service.mindmap;

import com.flamingo.ai.mindmap.domain.model.ClusterTree;
import com.flamingo.ai.mindmap.domain.model.RootSummary;
import com.flamingo.ai.mindmap.domain.model.TextSegment;
import com.flamingo.ai.mindmap.service.clustering.RecursiveTreeBuilder;
import com.flamingo.ai.mindmap.service.embedding.EmbeddingProvider;
import com.flamingo.ai.mindmap.service.enrichment.NodeEnrichmentService;
import com.flamingo.ai.mindmap.service.naming.RootNamingService;
import com.flamingo.ai.mindmap.service.relationship.RelationshipExtractor;
import com.flamingo.ai.mindmap.service.relationship.RelationshipSummary;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of {@link MindmapService} running all stages synchronously. */
@Service
@RequiredArgsConstructor
@Slf4j
public class MindmapServiceImpl implements MindmapService {

  private final MindmapRequestValidator requestValidator;
  private final SegmentPreprocessor segmentPreprocessor;
  private final EmbeddingProvider embeddingProvider;
  private final RecursiveTreeBuilder treeBuilder;
  private final NodeEnrichmentService enrichmentService;
  private final RelationshipExtractor relationshipExtractor;
  private final RootNamingService rootNamingService;
  private final TreeStructureValidator treeStructureValidator;

  @Override
  @Timed(value = "mindmap.generate", description = "Time to generate a mindmap")
  public MindmapResult generate(MindmapCommand command) {
    MindmapParameters parameters = requestValidator.validate(command);
    List<TextSegment> segments =
        command.segments() != null && !command.segments().isEmpty()
            ? segmentPreprocessor.fromSegments(command.segments())
            : segmentPreprocessor.fromDocument(command.document());
    log.info(
        "Generating mindmap from {} segments (language={}, maxDepth={}, minSize={})",
        segments.size(),
        parameters.language().getDisplayName(),
        parameters.maxDepth(),
        parameters.minSize());

    List<float[]> embeddings =
        embeddingProvider.encode(segments.stream().map(TextSegment::cleanedText).toList());

    ClusterTree tree =
        treeBuilder.build(segments, embeddings, parameters.maxDepth(), parameters.minSize());
    enrichmentService.enrich(tree, segments, parameters.language());
    RelationshipSummary relationships = relationshipExtractor.extract(tree, embeddings);
    RootSummary rootSummary = rootNamingService.name(tree, parameters.language());

    treeStructureValidator.validate(tree, segments.size());
    log.info(
        "Mindmap '{}' ready: {} nodes, {} leaves, depth {}",
        rootSummary.title(),
        tree.size(),
        tree.leaves().size(),
        tree.maxDepth());
    return new MindmapResult(
        rootSummary, parameters.language(), tree, segments, relationships, parameters);
  }
}
