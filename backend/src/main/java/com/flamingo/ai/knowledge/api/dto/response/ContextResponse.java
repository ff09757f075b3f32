package com.flamingo.ai.knowledge.api.dto.response;

import com.flamingo.ai.knowledge.service.retrieval.PromptContext;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for assembled prompt context. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextResponse {

  private String contextText;
  private List<SourceInfo> sources;
  private int tokenCount;

  public static ContextResponse from(PromptContext context) {
    return ContextResponse.builder()
        .contextText(context.contextText())
        .sources(
            context.sources().stream()
                .map(s -> new SourceInfo(s.documentId(), s.title(), s.similarity()))
                .toList())
        .tokenCount(context.tokenCount())
        .build();
  }

  /** A document that contributed to the context. */
  public record SourceInfo(UUID documentId, String title, double similarity) {}
}
