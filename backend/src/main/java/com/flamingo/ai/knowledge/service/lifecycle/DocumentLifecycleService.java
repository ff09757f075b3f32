package com.flamingo.ai.knowledge.service.lifecycle;

import com.flamingo.ai.knowledge.domain.entity.KnowledgeDocument;
import com.flamingo.ai.knowledge.store.KnowledgeStats;
import java.util.List;
import java.util.UUID;

/** Manages documents after ingestion: state transitions, metadata and removal. */
public interface DocumentLifecycleService {

  /**
   * Gets a document by ID.
   *
   * @throws com.flamingo.ai.knowledge.exception.DocumentNotFoundException if not found
   */
  KnowledgeDocument getDocument(UUID documentId);

  /** Lists documents matching the filter, newest first. */
  List<KnowledgeDocument> listDocuments(DocumentFilter filter);

  /** Lists a user's own non-admin documents, newest first. */
  List<KnowledgeDocument> listOwnedDocuments(String owner);

  /**
   * Runs a processing pass on a {@code PENDING} or {@code FAILED} document.
   *
   * @throws com.flamingo.ai.knowledge.exception.DocumentStateConflictException if the document is
   *     {@code READY} or already {@code PROCESSING}
   */
  KnowledgeDocument process(UUID documentId);

  /**
   * Returns a {@code READY} or {@code FAILED} document to {@code PENDING} and processes it again.
   * A {@code PENDING} document is processed directly.
   *
   * @throws com.flamingo.ai.knowledge.exception.DocumentStateConflictException if a pass is
   *     already in flight
   */
  KnowledgeDocument reprocess(UUID documentId);

  /**
   * Checks that a document can be processed and submits it to the processing executor.
   *
   * @return the document as it was before the pass started
   * @throws com.flamingo.ai.knowledge.exception.DocumentStateConflictException if the document is
   *     {@code READY} or already {@code PROCESSING}
   * @throws org.springframework.core.task.TaskRejectedException if the executor is saturated
   */
  KnowledgeDocument submitForProcessing(UUID documentId);

  /**
   * Submits every {@code PENDING} document to the processing executor. Documents the executor
   * refuses are left {@code PENDING} and reported as deferred.
   */
  PendingSubmission processPending();

  /**
   * Fails documents stuck in {@code PROCESSING} without a pass running in this process, e.g. after
   * a restart, so they can be reprocessed.
   *
   * @return number of documents recovered
   */
  int recoverInterrupted();

  /**
   * Requests cancellation of an in-flight pass.
   *
   * @return true if a running pass was flagged
   */
  boolean cancel(UUID documentId);

  KnowledgeDocument updateDocument(UUID documentId, DocumentUpdate update);

  /**
   * Deletes a document with all of its chunks, then its stored source file.
   *
   * @throws com.flamingo.ai.knowledge.exception.DocumentNotFoundException if not found
   */
  void deleteDocument(UUID documentId);

  KnowledgeStats getStats();

  /** Documents whose chunks were embedded by a model other than the active one. */
  List<KnowledgeDocument> findStaleDocuments();
}
