package com.flamingo.ai.knowledge.service.lifecycle;

import com.flamingo.ai.knowledge.domain.entity.KnowledgeDocument;
import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledge.domain.enums.KnowledgeDocumentType;

/**
 * Optional criteria for listing documents; null fields match everything.
 *
 * @param limit maximum number of documents, or null for all
 */
public record DocumentFilter(
    KnowledgeDocumentType docType, DocumentStatus status, Boolean active, Integer limit) {

  public static DocumentFilter all() {
    return new DocumentFilter(null, null, null, null);
  }

  public boolean matches(KnowledgeDocument document) {
    return (docType == null || docType == document.getDocType())
        && (status == null || status == document.getStatus())
        && (active == null || active == document.isActive());
  }
}
