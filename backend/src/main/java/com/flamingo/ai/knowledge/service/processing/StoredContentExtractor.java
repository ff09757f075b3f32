package com.flamingo.ai.knowledge.service.processing;

import com.flamingo.ai.knowledge.domain.entity.KnowledgeDocument;
import com.flamingo.ai.knowledge.domain.enums.SourceType;
import com.flamingo.ai.knowledge.exception.ExtractionFailureException;
import org.springframework.stereotype.Component;

/** Serves the text captured at ingestion time. */
@Component
public class StoredContentExtractor implements ContentExtractor {

  @Override
  public String extractText(KnowledgeDocument document) {
    String raw = document.getRawContent();
    if (raw != null && !raw.isBlank()) {
      return raw;
    }
    if (document.getSourceType() == SourceType.URL) {
      throw new ExtractionFailureException(
          document.getId(), "URL content has not been fetched yet");
    }
    throw new ExtractionFailureException(document.getId(), "Document has no extracted text");
  }
}
