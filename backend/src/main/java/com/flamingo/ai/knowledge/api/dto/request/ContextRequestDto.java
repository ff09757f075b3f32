package com.flamingo.ai.knowledge.api.dto.request;

import com.flamingo.ai.knowledge.domain.enums.KnowledgeDocumentType;
import com.flamingo.ai.knowledge.service.retrieval.ContextRequest;
import com.flamingo.ai.knowledge.service.retrieval.Visibility;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for prompt context assembly. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextRequestDto {

  @NotBlank(message = "Query is required")
  private String query;

  private String targetFunction;
  private String targetPlatform;
  private KnowledgeDocumentType docType;

  /** When set, the owner's own uploads are included next to the admin-managed documents. */
  private String owner;

  @Min(value = 1, message = "maxTokens must be positive")
  private Integer maxTokens;

  public ContextRequest toContextRequest() {
    return ContextRequest.builder()
        .query(query)
        .targetFunction(targetFunction)
        .targetPlatform(targetPlatform)
        .docType(docType)
        .visibility(owner != null ? Visibility.forOwner(owner) : Visibility.adminManagedOnly())
        .maxTokens(maxTokens)
        .build();
  }
}
