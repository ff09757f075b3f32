package com.flamingo.ai.knowledge.api.dto.response;

import com.flamingo.ai.knowledge.domain.enums.KnowledgeDocumentType;
import com.flamingo.ai.knowledge.service.retrieval.SearchResult;
import java.util.Set;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a ranked chunk. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResultResponse {

  private UUID chunkId;
  private UUID documentId;
  private String documentTitle;
  private KnowledgeDocumentType docType;
  private String content;
  private double similarity;
  private int priority;
  private Set<String> tags;
  private double score;

  public static SearchResultResponse from(SearchResult result) {
    return SearchResultResponse.builder()
        .chunkId(result.chunkId())
        .documentId(result.documentId())
        .documentTitle(result.documentTitle())
        .docType(result.docType())
        .content(result.content())
        .similarity(result.similarity())
        .priority(result.priority())
        .tags(result.tags())
        .score(result.score())
        .build();
  }
}
