package com.flamingo.ai.knowledge.api.dto.request;

import com.flamingo.ai.knowledge.domain.enums.KnowledgeDocumentType;
import com.flamingo.ai.knowledge.service.retrieval.SearchRequest;
import com.flamingo.ai.knowledge.service.retrieval.Visibility;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a knowledge search. Without an owner only admin-managed documents are searched;
 * with one, the owner's own uploads are included unless {@code includeUserManaged} is false.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchKnowledgeRequest {

  @NotBlank(message = "Query is required")
  private String query;

  private String targetFunction;
  private String targetPlatform;
  private KnowledgeDocumentType docType;

  @Min(value = 1, message = "topK must be between 1 and 100")
  @Max(value = 100, message = "topK must be between 1 and 100")
  private Integer topK;

  @DecimalMin(value = "-1.0", message = "minSimilarity must be between -1 and 1")
  @DecimalMax(value = "1.0", message = "minSimilarity must be between -1 and 1")
  private Double minSimilarity;

  private String owner;

  @Builder.Default private boolean includeAdminManaged = true;

  @Builder.Default private boolean includeUserManaged = true;

  public Visibility toVisibility() {
    return new Visibility(owner, includeAdminManaged, owner != null && includeUserManaged);
  }

  public SearchRequest toSearchRequest() {
    return SearchRequest.builder()
        .query(query)
        .targetFunction(targetFunction)
        .targetPlatform(targetPlatform)
        .docType(docType)
        .topK(topK)
        .minSimilarity(minSimilarity)
        .visibility(toVisibility())
        .build();
  }
}
