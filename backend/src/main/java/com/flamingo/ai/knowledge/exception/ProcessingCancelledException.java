package com.flamingo.ai.knowledge.exception;

import java.util.UUID;

/** Exception thrown inside a processing pass once its cancellation has been requested. */
public class ProcessingCancelledException extends RuntimeException {

  private final UUID documentId;

  public ProcessingCancelledException(UUID documentId) {
    super("Processing cancelled");
    this.documentId = documentId;
  }

  public UUID getDocumentId() {
    return documentId;
  }
}
