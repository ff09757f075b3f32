package com.flamingo.ai.knowledge.store;

import com.flamingo.ai.knowledge.domain.entity.KnowledgeChunk;
import com.flamingo.ai.knowledge.domain.entity.KnowledgeDocument;
import com.flamingo.ai.knowledge.domain.enums.DocumentScope;
import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Persistence contract for documents and their chunks. Every method is its own unit of work;
 * {@link #replaceChunks} and {@link #deleteDocumentCascade} are atomic.
 */
public interface KnowledgeStore {

  /** Persists a new document and returns it with its assigned id. */
  KnowledgeDocument createDocument(KnowledgeDocument document);

  Optional<KnowledgeDocument> getDocument(UUID documentId);

  /**
   * Finds active documents carrying {@code contentHash}. For {@link DocumentScope#USER} uploads,
   * admin-managed matches come first.
   */
  List<KnowledgeDocument> findByContentHash(String contentHash, DocumentScope scope);

  /**
   * Sets the status, recording {@code error} as the processing error when the status is {@link
   * DocumentStatus#FAILED}.
   *
   * @throws com.flamingo.ai.knowledge.exception.DocumentNotFoundException if the document is gone
   */
  KnowledgeDocument updateDocumentStatus(UUID documentId, DocumentStatus status, String error);

  /**
   * Moves the document to {@code target} only if its status is currently one of {@code expected}.
   * This is the per-document guard against concurrent processing.
   *
   * @return true if the transition happened
   */
  boolean compareAndSetStatus(UUID documentId, Set<DocumentStatus> expected, DocumentStatus target);

  /**
   * Deletes every existing chunk of the document and inserts {@code chunks} in one transaction.
   *
   * @return number of chunks stored
   */
  int replaceChunks(UUID documentId, List<KnowledgeChunk> chunks);

  /** Marks the document {@link DocumentStatus#READY} with its chunk count. */
  KnowledgeDocument markReady(UUID documentId, int chunkCount);

  /** Applies {@code changes} to the document and saves it. */
  KnowledgeDocument updateDocument(UUID documentId, Consumer<KnowledgeDocument> changes);

  /**
   * Deletes the document and all of its chunks in one transaction.
   *
   * @return the deleted document, or empty if none existed
   */
  Optional<KnowledgeDocument> deleteDocumentCascade(UUID documentId);

  /** Lists the chunks of the given documents, grouped by document in chunk order. */
  List<KnowledgeChunk> listChunks(Collection<UUID> documentIds);

  /** Active documents in {@link DocumentStatus#READY}, the candidates for search. */
  List<KnowledgeDocument> findSearchableDocuments();

  /** Documents in the given status, oldest first. */
  List<KnowledgeDocument> findByStatus(DocumentStatus status);

  /** All documents, newest first. */
  List<KnowledgeDocument> listDocuments();

  /** A user's own non-admin documents, newest first. */
  List<KnowledgeDocument> listOwnedDocuments(String owner);

  /** Increments usage count and sets last-used time on the given documents. */
  void recordUsage(Collection<UUID> documentIds);

  /** Ids of documents with chunks embedded by a model other than {@code modelId}. */
  List<UUID> findDocumentIdsWithStaleEmbeddings(String modelId);

  /** Aggregate counters over the whole store. */
  KnowledgeStats stats();
}
