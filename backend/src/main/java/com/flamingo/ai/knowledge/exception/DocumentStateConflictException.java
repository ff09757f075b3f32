package com.flamingo.ai.knowledge.exception;

import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import java.util.UUID;

/** Exception thrown when a lifecycle operation is not valid in the document's current status. */
public class DocumentStateConflictException extends RuntimeException {

  private final UUID documentId;
  private final DocumentStatus currentStatus;

  public DocumentStateConflictException(
      UUID documentId, DocumentStatus currentStatus, String operation) {
    super(
        String.format(
            "Cannot %s document %s while it is %s", operation, documentId, currentStatus));
    this.documentId = documentId;
    this.currentStatus = currentStatus;
  }

  public UUID getDocumentId() {
    return documentId;
  }

  public DocumentStatus getCurrentStatus() {
    return currentStatus;
  }
}
