package com.flamingo.ai.mindmap.exception;

/** Exception thrown when the embedding backend cannot serve a request. */
public class ProviderUnavailableException extends RuntimeException {

  private final String userMessage;

  public ProviderUnavailableException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Embedding service is temporarily unavailable. Please try again later.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
