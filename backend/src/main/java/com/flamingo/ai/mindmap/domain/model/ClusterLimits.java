package com.flamingo.ai.mindmap.domain.model;

/** Depth ceiling and minimum group size in effect when a node is constructed. */
public record ClusterLimits(int maxDepth, int minSize) {}
