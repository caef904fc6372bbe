package com.flamingo.ai.mindmap.service.relationship;

import com.flamingo.ai.mindmap.domain.model.Relationship;
import java.util.List;

/**
 * Aggregate view of the relationships extracted from a tree.
 *
 * @param totalRelationships relationships across all leaves
 * @param averagePerCluster total divided by the number of leaves
 * @param strongest highest-confidence relationship, null when there is none
 * @param weakest lowest-confidence relationship, null when there is none
 * @param averageConfidence mean confidence, 0 when there is none
 * @param similarityThreshold threshold the relationships were selected with
 * @param clusters per-leaf counts in tree order
 */
public record RelationshipSummary(
    int totalRelationships,
    double averagePerCluster,
    Relationship strongest,
    Relationship weakest,
    double averageConfidence,
    double similarityThreshold,
    List<RelationshipStats> clusters) {}
