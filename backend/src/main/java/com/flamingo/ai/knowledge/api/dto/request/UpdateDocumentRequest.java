package com.flamingo.ai.knowledge.api.dto.request;

import com.flamingo.ai.knowledge.service.lifecycle.DocumentUpdate;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for updating document metadata. Omitted fields are left unchanged. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateDocumentRequest {

  @Size(min = 1, max = 500, message = "Title must be between 1 and 500 characters")
  private String title;

  private String description;
  private Set<String> targetFunctions;
  private Set<String> targetPlatforms;
  private Set<String> tags;

  @Min(value = 1, message = "Priority must be between 1 and 10")
  @Max(value = 10, message = "Priority must be between 1 and 10")
  private Integer priority;

  private Boolean active;

  public DocumentUpdate toDocumentUpdate() {
    return DocumentUpdate.builder()
        .title(title)
        .description(description)
        .targetFunctions(targetFunctions)
        .targetPlatforms(targetPlatforms)
        .tags(tags)
        .priority(priority)
        .active(active)
        .build();
  }
}
