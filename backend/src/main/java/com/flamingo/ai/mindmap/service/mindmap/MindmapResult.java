package com.flamingo.ai.mindmap.service.mindmap;

import com.flamingo.ai.mindmap.domain.enums.Language;
import com.flamingo.ai.mindmap.domain.model.ClusterTree;
import com.flamingo.ai.mindmap.domain.model.RootSummary;
import com.flamingo.ai.mindmap.domain.model.TextSegment;
import com.flamingo.ai.mindmap.service.relationship.RelationshipSummary;
import java.util.List;

/**
 * A validated, enriched mindmap.
 *
 * @param rootSummary title and overview
 * @param language language of all generated texts
 * @param tree the topic tree
 * @param segments segments the tree's member indices refer to
 * @param relationships relationship statistics
 * @param parameters parameters the tree was built with
 */
public record MindmapResult(
    RootSummary rootSummary,
    Language language,
    ClusterTree tree,
    List<TextSegment> segments,
    RelationshipSummary relationships,
    MindmapParameters parameters) {}
