package com.flamingo.ai.knowledge.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/** Defines the processing status of a knowledge document. */
public enum DocumentStatus {
  /** Document has been added but not yet processed. */
  PENDING,

  /** Document is currently being processed (chunking, embedding, storing). */
  PROCESSING,

  /** Document has been successfully processed and is searchable. */
  READY,

  /** Document processing failed. */
  FAILED;

  /** States from which a processing pass may start. */
  public static final Set<DocumentStatus> PROCESSABLE = EnumSet.of(PENDING, FAILED);

  /** States from which a reprocess request may reset the document to {@link #PENDING}. */
  public static final Set<DocumentStatus> REPROCESSABLE = EnumSet.of(READY, FAILED);
}
