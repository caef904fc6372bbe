package com.flamingo.ai.mindmap.service.mindmap;

/** Generates mindmaps from documents. */
public interface MindmapService {

  /**
   * Runs the whole pipeline: segmentation, embedding, clustering, enrichment, relationship
   * extraction and naming.
   *
   * @param command input and options
   * @return the finished mindmap
   * @throws com.flamingo.ai.mindmap.exception.InvalidInputException for unusable input
   * @throws com.flamingo.ai.mindmap.exception.ProviderUnavailableException when embeddings fail
   */
  MindmapResult generate(MindmapCommand command);
}
