package com.flamingo.ai.knowledge.exception;

import java.util.UUID;

/** Exception thrown when a document's text is empty or cannot be obtained. */
public class ExtractionFailureException extends RuntimeException {

  private final UUID documentId;

  public ExtractionFailureException(String message) {
    this(null, message);
  }

  public ExtractionFailureException(UUID documentId, String message) {
    super(message);
    this.documentId = documentId;
  }

  /** The affected document, or null when ingestion was rejected before one was created. */
  public UUID getDocumentId() {
    return documentId;
  }
}
