package com.flamingo.ai.mindmap.domain.model;

/**
 * One unit of input text carried through the pipeline.
 *
 * @param index position of the segment in the invocation, aligned with its embedding
 * @param rawText the text as received from ingestion
 * @param cleanedText normalized text used for prompts
 */
public record TextSegment(int index, String rawText, String cleanedText) {}
