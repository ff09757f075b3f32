package com.flamingo.ai.knowledge.service.processing;

import com.flamingo.ai.knowledge.domain.entity.KnowledgeDocument;

/**
 * Supplies the text a processing pass chunks and embeds. File parsing and URL crawling live
 * behind this seam.
 */
public interface ContentExtractor {

  /**
   * Returns the extracted text of the document.
   *
   * @throws com.flamingo.ai.knowledge.exception.ExtractionFailureException if no usable text is
   *     available
   */
  String extractText(KnowledgeDocument document);
}
