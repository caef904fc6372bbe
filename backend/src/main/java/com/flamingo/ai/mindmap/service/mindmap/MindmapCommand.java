package com.flamingo.ai.mindmap.service.mindmap;

import java.util.List;

/**
 * Input of one mindmap generation. Either a document, split into segments line by line, or
 * pre-split segments must be given; optional values fall back to the configured defaults.
 *
 * @param document full document text, may be null when segments are given
 * @param segments pre-split segments, may be null when a document is given
 * @param language language code or name, may be null
 * @param maxDepth depth ceiling override, may be null
 * @param minSize minimum group size override, may be null
 */
public record MindmapCommand(
    String document, List<String> segments, String language, Integer maxDepth, Integer minSize) {}
