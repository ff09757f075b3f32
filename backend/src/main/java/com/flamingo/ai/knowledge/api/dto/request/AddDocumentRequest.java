package com.flamingo.ai.knowledge.api.dto.request;

import com.flamingo.ai.knowledge.domain.enums.DocumentScope;
import com.flamingo.ai.knowledge.domain.enums.KnowledgeDocumentType;
import com.flamingo.ai.knowledge.domain.enums.SourceType;
import com.flamingo.ai.knowledge.service.ingestion.IngestionRequest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for adding a document with already extracted text or a URL. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddDocumentRequest {

  @NotBlank(message = "Title is required")
  @Size(max = 500, message = "Title must be at most 500 characters")
  private String title;

  private String description;

  private KnowledgeDocumentType docType;

  @NotNull(message = "Source type is required")
  private SourceType sourceType;

  private String extractedText;

  private String sourceUrl;

  private String fileName;
  private String filePath;
  private Long fileSize;
  private String mimeType;
  private Integer crawlDepth;

  private DocumentScope scope;

  private boolean adminManaged;

  private Set<String> targetFunctions;
  private Set<String> targetPlatforms;
  private Set<String> tags;

  @Min(value = 1, message = "Priority must be between 1 and 10")
  @Max(value = 10, message = "Priority must be between 1 and 10")
  private Integer priority;

  @NotBlank(message = "Owner is required")
  private String owner;

  /** Converts to the ingestion input. */
  public IngestionRequest toIngestionRequest() {
    return IngestionRequest.builder()
        .title(title)
        .description(description)
        .docType(docType)
        .sourceType(sourceType)
        .extractedText(extractedText)
        .sourceUrl(sourceUrl)
        .fileName(fileName)
        .filePath(filePath)
        .fileSize(fileSize)
        .mimeType(mimeType)
        .crawlDepth(crawlDepth)
        .scope(scope)
        .adminManaged(adminManaged)
        .targetFunctions(targetFunctions)
        .targetPlatforms(targetPlatforms)
        .tags(tags)
        .priority(priority)
        .owner(owner)
        .build();
  }
}
