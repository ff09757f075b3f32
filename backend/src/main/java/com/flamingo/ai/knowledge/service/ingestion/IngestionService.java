package com.flamingo.ai.knowledge.service.ingestion;

import com.flamingo.ai.knowledge.domain.entity.KnowledgeDocument;

/** Admits documents into the knowledge base. */
public interface IngestionService {

  /**
   * Validates and deduplicates the request, then creates the document in {@code PENDING}.
   * Processing is a separate step.
   *
   * @param request the ingestion input
   * @return the created document
   * @throws com.flamingo.ai.knowledge.exception.DuplicateDocumentException if the content is
   *     already known to the owner or to the admin-managed knowledge base
   * @throws com.flamingo.ai.knowledge.exception.ExtractionFailureException if no usable text or URL
   *     was supplied
   */
  KnowledgeDocument addDocument(IngestionRequest request);

  /** SHA-256 hex digest of {@code content}, the deduplication key. */
  String computeContentHash(String content);
}
