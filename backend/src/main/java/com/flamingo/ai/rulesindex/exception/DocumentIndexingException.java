package com.flamingo.ai.rulesindex.exception;

/** Exception thrown when a source document cannot be indexed. */
public class DocumentIndexingException extends RuntimeException {

  private final String sourceId;
  private final String userMessage;

  public DocumentIndexingException(String sourceId, String message) {
    super(message);
    this.sourceId = sourceId;
    this.userMessage = "Failed to index rules source";
  }

  public DocumentIndexingException(String sourceId, String message, Throwable cause) {
    super(message, cause);
    this.sourceId = sourceId;
    this.userMessage = "Failed to index rules source";
  }

  public DocumentIndexingException(String sourceId, String message, String userMessage) {
    super(message);
    this.sourceId = sourceId;
    this.userMessage = userMessage;
  }

  public String getSourceId() {
    return sourceId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
