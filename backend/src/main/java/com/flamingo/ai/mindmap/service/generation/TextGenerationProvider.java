package com.flamingo.ai.mindmap.service.generation;

/** Turns a prompt into free text. No structural guarantee is made about the response. */
public interface TextGenerationProvider {

  /**
   * Generates a response for a prompt.
   *
   * @param prompt fully rendered prompt
   * @return the raw response, possibly empty or malformed
   * @throws com.flamingo.ai.mindmap.exception.LlmServiceException when the backend call fails
   */
  String generate(String prompt);
}
