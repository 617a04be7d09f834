package com.avaolo.ai.knowledge.exception;

/** Thrown when no embedding could be produced for text that must be indexed. */
public class EmbeddingServiceException extends RuntimeException {

  private final String userMessage;

  public EmbeddingServiceException(String message) {
    super(message);
    this.userMessage = "Embedding service is temporarily unavailable. Please try again later.";
  }

  public EmbeddingServiceException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Embedding service is temporarily unavailable. Please try again later.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
