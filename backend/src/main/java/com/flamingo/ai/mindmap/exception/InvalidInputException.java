package com.flamingo.ai.mindmap.exception;

/**
 * Thrown when the caller supplies input the pipeline cannot work with: an empty or too short
 * document, out-of-range parameters, an unsupported language or malformed embeddings. Never retried.
 */
public class InvalidInputException extends RuntimeException {

  public InvalidInputException(String message) {
    super(message);
  }

  public InvalidInputException(String message, Throwable cause) {
    super(message, cause);
  }
}
