package com.flamingo.ai.mindmap.domain.model;

/**
 * Title and overview of a whole mindmap.
 *
 * @param title short title in the target language
 * @param summary one-to-two sentence overview
 * @param fallback true when the generated result could not be used
 */
public record RootSummary(String title, String summary, boolean fallback) {}
