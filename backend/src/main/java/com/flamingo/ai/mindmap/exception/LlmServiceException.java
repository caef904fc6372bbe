package com.flamingo.ai.mindmap.exception;

/** Exception thrown when the text generation backend fails. */
public class LlmServiceException extends RuntimeException {

  private final boolean rateLimited;

  public LlmServiceException(String message) {
    super(message);
    this.rateLimited = false;
  }

  public LlmServiceException(String message, Throwable cause) {
    super(message, cause);
    this.rateLimited = false;
  }

  public LlmServiceException(String message, Throwable cause, boolean rateLimited) {
    super(message, cause);
    this.rateLimited = rateLimited;
  }

  public boolean isRateLimited() {
    return rateLimited;
  }
}
