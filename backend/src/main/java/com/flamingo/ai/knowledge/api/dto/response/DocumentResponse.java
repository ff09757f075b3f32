package com.flamingo.ai.knowledge.api.dto.response;

import com.flamingo.ai.knowledge.domain.entity.DocumentSource;
import com.flamingo.ai.knowledge.domain.entity.KnowledgeDocument;
import com.flamingo.ai.knowledge.domain.enums.DocumentScope;
import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledge.domain.enums.KnowledgeDocumentType;
import com.flamingo.ai.knowledge.domain.enums.SourceType;
import java.time.LocalDateTime;
import java.util.Set;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for document data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

  private UUID id;
  private String title;
  private String description;
  private KnowledgeDocumentType docType;
  private DocumentScope scope;
  private boolean adminManaged;
  private SourceType sourceType;
  private String fileName;
  private String mimeType;
  private Long fileSize;
  private String sourceUrl;
  private DocumentStatus status;
  private String processingError;
  private int chunkCount;
  private Set<String> targetFunctions;
  private Set<String> targetPlatforms;
  private Set<String> tags;
  private int priority;
  private boolean active;
  private long usageCount;
  private LocalDateTime lastUsedAt;
  private String uploadedBy;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;
  private LocalDateTime processedAt;

  /** Creates a DocumentResponse from a KnowledgeDocument entity. */
  public static DocumentResponse fromEntity(KnowledgeDocument document) {
    DocumentSource source =
        document.getSource() != null ? document.getSource() : new DocumentSource();
    return DocumentResponse.builder()
        .id(document.getId())
        .title(document.getTitle())
        .description(document.getDescription())
        .docType(document.getDocType())
        .scope(document.getScope())
        .adminManaged(document.isAdminManaged())
        .sourceType(document.getSourceType())
        .fileName(source.getFileName())
        .mimeType(source.getMimeType())
        .fileSize(source.getFileSize())
        .sourceUrl(source.getSourceUrl())
        .status(document.getStatus())
        .processingError(document.getProcessingError())
        .chunkCount(document.getChunkCount())
        .targetFunctions(document.getTargetFunctions())
        .targetPlatforms(document.getTargetPlatforms())
        .tags(document.getTags())
        .priority(document.getPriority())
        .active(document.isActive())
        .usageCount(document.getUsageCount())
        .lastUsedAt(document.getLastUsedAt())
        .uploadedBy(document.getUploadedBy())
        .createdAt(document.getCreatedAt())
        .updatedAt(document.getUpdatedAt())
        .processedAt(document.getProcessedAt())
        .build();
  }
}
