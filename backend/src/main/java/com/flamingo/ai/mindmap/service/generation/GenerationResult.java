package com.flamingo.ai.mindmap.service.generation;

import java.util.function.Supplier;

/**
 * Outcome of a validated generation. Either a cleaned, valid text or an exhausted marker that tells
 * the caller to use its fallback.
 *
 * @param text the valid text, null when exhausted
 * @param attempts number of calls made to the backend
 * @param lastFailure why the last attempt was rejected, null on success
 */
public record GenerationResult(String text, int attempts, String lastFailure) {

  public static GenerationResult success(String text, int attempts) {
    return new GenerationResult(text, attempts, null);
  }

  public static GenerationResult exhausted(int attempts, String lastFailure) {
    return new GenerationResult(null, attempts, lastFailure);
  }

  public boolean isSuccess() {
    return text != null;
  }

  public String orElseGet(Supplier<String> fallback) {
    return isSuccess() ? text : fallback.get();
  }
}
