package com.flamingo.ai.mindmap.service.embedding;

import java.util.List;

/** Turns texts into fixed-length vectors. */
public interface EmbeddingProvider {

  /**
   * Encodes texts into embeddings.
   *
   * @param texts texts to encode
   * @return one vector per text, in input order, all of the same dimensionality
   * @throws com.flamingo.ai.mindmap.exception.ProviderUnavailableException when the backend fails
   */
  List<float[]> encode(List<String> texts);
}
