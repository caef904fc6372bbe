package com.flamingo.ai.mindmap.service.relationship;

/**
 * Relationship counts for one leaf cluster.
 *
 * @param clusterId leaf node id
 * @param conceptCount members in the leaf
 * @param relationshipCount directed relationships found
 * @param density relationships over the {@code m * (m - 1)} possible directed pairs, 0 for m < 2
 */
public record RelationshipStats(
    String clusterId, int conceptCount, int relationshipCount, double density) {

  static RelationshipStats of(String clusterId, int conceptCount, int relationshipCount) {
    double density =
        conceptCount > 1
            ? (double) relationshipCount / ((double) conceptCount * (conceptCount - 1))
            : 0.0;
    return new RelationshipStats(clusterId, conceptCount, relationshipCount, density);
  }
}
