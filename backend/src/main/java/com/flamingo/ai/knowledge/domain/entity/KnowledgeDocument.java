package com.flamingo.ai.knowledge.domain.entity;

import com.flamingo.ai.knowledge.domain.converter.StringSetConverter;
import com.flamingo.ai.knowledge.domain.enums.DocumentScope;
import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledge.domain.enums.KnowledgeDocumentType;
import com.flamingo.ai.knowledge.domain.enums.SourceType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A document in the knowledge base. Owns its {@link KnowledgeChunk}s; deleting the document
 * deletes every chunk with it.
 */
@Entity
@Table(
    name = "knowledge_documents",
    indexes = {
      @Index(name = "idx_knowledge_content_hash", columnList = "content_hash"),
      @Index(name = "idx_knowledge_status", columnList = "status"),
      @Index(name = "idx_knowledge_doc_type", columnList = "doc_type")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class KnowledgeDocument {

  public static final int MIN_PRIORITY = 1;
  public static final int MAX_PRIORITY = 10;
  public static final int DEFAULT_PRIORITY = 5;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false, length = 500)
  private String title;

  @Column(columnDefinition = "TEXT")
  private String description;

  @Enumerated(EnumType.STRING)
  @Column(name = "doc_type", nullable = false)
  @Builder.Default
  private KnowledgeDocumentType docType = KnowledgeDocumentType.CUSTOM;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private DocumentScope scope = DocumentScope.GLOBAL;

  /** True for organization-wide documents curated by administrators. */
  @Column(name = "admin_managed", nullable = false)
  private boolean adminManaged;

  @Enumerated(EnumType.STRING)
  @Column(name = "source_type", nullable = false)
  private SourceType sourceType;

  @Embedded @Builder.Default private DocumentSource source = new DocumentSource();

  /** SHA-256 of the extracted text, or of the source URL before its content is fetched. */
  @Column(name = "content_hash", length = 64)
  private String contentHash;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private DocumentStatus status = DocumentStatus.PENDING;

  /** Error message if processing failed. */
  @Column(name = "processing_error", columnDefinition = "TEXT")
  private String processingError;

  /** Full extracted text, input of every processing pass. */
  @Column(name = "raw_content", columnDefinition = "TEXT")
  private String rawContent;

  @Column(name = "chunk_count", nullable = false)
  private int chunkCount;

  @Convert(converter = StringSetConverter.class)
  @Column(name = "target_functions", columnDefinition = "TEXT")
  @Builder.Default
  private Set<String> targetFunctions = new LinkedHashSet<>();

  @Convert(converter = StringSetConverter.class)
  @Column(name = "target_platforms", columnDefinition = "TEXT")
  @Builder.Default
  private Set<String> targetPlatforms = new LinkedHashSet<>();

  @Convert(converter = StringSetConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private Set<String> tags = new LinkedHashSet<>();

  /** Ranking weight, 1-10; higher ranks first. */
  @Column(nullable = false)
  @Builder.Default
  private int priority = DEFAULT_PRIORITY;

  @Column(nullable = false)
  @Builder.Default
  private boolean active = true;

  @Column(name = "usage_count", nullable = false)
  private long usageCount;

  @Column(name = "last_used_at")
  private LocalDateTime lastUsedAt;

  @Column(name = "uploaded_by", nullable = false)
  private String uploadedBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @Column(name = "updated_at")
  private LocalDateTime updatedAt;

  @Column(name = "processed_at")
  private LocalDateTime processedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
    updatedAt = createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  /** Marks the document as successfully processed. */
  public void markReady(int chunkCount) {
    this.status = DocumentStatus.READY;
    this.chunkCount = chunkCount;
    this.processingError = null;
    this.processedAt = LocalDateTime.now();
  }

  /** Marks the document as failed with an error message. */
  public void markFailed(String errorMessage) {
    this.status = DocumentStatus.FAILED;
    this.processingError = errorMessage;
    this.processedAt = LocalDateTime.now();
  }

  /**
   * Whether the document applies to the given function or platform. An empty restriction set
   * matches everything, as does a null target.
   */
  public boolean appliesTo(String targetFunction, String targetPlatform) {
    return matches(targetFunctions, targetFunction) && matches(targetPlatforms, targetPlatform);
  }

  private static boolean matches(Set<String> restriction, String target) {
    return target == null || restriction == null || restriction.isEmpty()
        || restriction.contains(target);
  }
}
