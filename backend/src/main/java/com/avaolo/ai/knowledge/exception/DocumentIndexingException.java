package com.avaolo.ai.knowledge.exception;

/** Thrown when a knowledge document or file cannot be accepted for indexing. */
public class DocumentIndexingException extends RuntimeException {

  private final String source;
  private final String userMessage;

  public DocumentIndexingException(String source, String message) {
    super(message);
    this.source = source;
    this.userMessage = "Failed to index document. Please check the content and try again.";
  }

  public DocumentIndexingException(String source, String message, String userMessage) {
    super(message);
    this.source = source;
    this.userMessage = userMessage;
  }

  public DocumentIndexingException(String source, String message, Throwable cause) {
    super(message, cause);
    this.source = source;
    this.userMessage = "Failed to index document. Please check the content and try again.";
  }

  public String getSource() {
    return source;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
