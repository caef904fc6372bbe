package com.flamingo.ai.mindmap.service.mindmap;

import com.flamingo.ai.mindmap.domain.enums.Language;

/** Resolved and range-checked generation parameters. */
public record MindmapParameters(Language language, int maxDepth, int minSize) {}
