package com.flamingo.ai.knowledge.exception;

import java.util.UUID;

/** Exception thrown when an ingested document collides with an existing one by content hash. */
public class DuplicateDocumentException extends RuntimeException {

  private final UUID existingDocumentId;
  private final String userMessage;

  public DuplicateDocumentException(UUID existingDocumentId, String userMessage) {
    super("Duplicate of document " + existingDocumentId + ": " + userMessage);
    this.existingDocumentId = existingDocumentId;
    this.userMessage = userMessage;
  }

  public UUID getExistingDocumentId() {
    return existingDocumentId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
