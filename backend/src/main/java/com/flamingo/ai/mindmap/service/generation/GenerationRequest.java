package com.flamingo.ai.mindmap.service.generation;

import com.flamingo.ai.mindmap.domain.enums.Language;

/**
 * A prompt together with the rules its response must satisfy.
 *
 * @param prompt rendered prompt, re-issued unchanged on every attempt
 * @param language language the response must be written in
 * @param maxRetries attempts allowed after the first one
 * @param maxWords word ceiling for the response
 */
public record GenerationRequest(String prompt, Language language, int maxRetries, int maxWords) {

  public GenerationRequest {
    if (prompt == null || prompt.isBlank()) {
      throw new IllegalArgumentException("Prompt must not be blank");
    }
    if (language == null) {
      throw new IllegalArgumentException("Language is required");
    }
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
    }
    if (maxWords < 1) {
      throw new IllegalArgumentException("maxWords must be >= 1: " + maxWords);
    }
  }
}
