package com.flamingo.ai.knowledge.service.ingestion;

import com.flamingo.ai.knowledge.config.RagConfig;
import com.flamingo.ai.knowledge.domain.entity.DocumentSource;
import com.flamingo.ai.knowledge.domain.entity.KnowledgeDocument;
import com.flamingo.ai.knowledge.domain.enums.DocumentScope;
import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledge.domain.enums.KnowledgeDocumentType;
import com.flamingo.ai.knowledge.domain.enums.SourceType;
import com.flamingo.ai.knowledge.exception.DuplicateDocumentException;
import com.flamingo.ai.knowledge.exception.ExtractionFailureException;
import com.flamingo.ai.knowledge.store.KnowledgeStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of the IngestionService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionServiceImpl implements IngestionService {

  private final KnowledgeStore knowledgeStore;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "knowledge.document.add", description = "Time to add a knowledge document")
  public KnowledgeDocument addDocument(IngestionRequest request) {
    validate(request);

    DocumentScope scope = request.scope() != null ? request.scope() : DocumentScope.GLOBAL;
    String contentHash = computeContentHash(hashInput(request));

    rejectDuplicates(contentHash, scope, request);

    KnowledgeDocument document =
        KnowledgeDocument.builder()
            .title(request.title().strip())
            .description(request.description())
            .docType(
                request.docType() != null ? request.docType() : KnowledgeDocumentType.CUSTOM)
            .scope(scope)
            .adminManaged(request.adminManaged())
            .sourceType(request.sourceType())
            .source(
                DocumentSource.builder()
                    .fileName(request.fileName())
                    .filePath(request.filePath())
                    .fileSize(request.fileSize())
                    .mimeType(request.mimeType())
                    .sourceUrl(request.sourceUrl())
                    .crawlDepth(request.crawlDepth())
                    .build())
            .contentHash(contentHash)
            .status(DocumentStatus.PENDING)
            .rawContent(hasText(request.extractedText()) ? request.extractedText() : null)
            .targetFunctions(copy(request.targetFunctions()))
            .targetPlatforms(copy(request.targetPlatforms()))
            .tags(copy(request.tags()))
            .priority(effectivePriority(request))
            .uploadedBy(request.owner())
            .build();

    KnowledgeDocument saved = knowledgeStore.createDocument(document);
    meterRegistry
        .counter("knowledge.document.added", "source", request.sourceType().name().toLowerCase())
        .increment();

    log.info(
        "Knowledge document {} added: title='{}', owner={}, scope={}, adminManaged={}",
        saved.getId(),
        saved.getTitle(),
        saved.getUploadedBy(),
        saved.getScope(),
        saved.isAdminManaged());
    return saved;
  }

  @Override
  public String computeContentHash(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  private void validate(IngestionRequest request) {
    if (request.title() == null || request.title().isBlank()) {
      throw new IllegalArgumentException("Title is required");
    }
    if (request.owner() == null || request.owner().isBlank()) {
      throw new IllegalArgumentException("Owner is required");
    }
    if (request.sourceType() == null) {
      throw new IllegalArgumentException("Source type is required");
    }
    Integer priority = request.priority();
    if (priority != null
        && (priority < KnowledgeDocument.MIN_PRIORITY || priority > KnowledgeDocument.MAX_PRIORITY)) {
      throw new IllegalArgumentException("Priority must be between 1 and 10: " + priority);
    }

    if (request.sourceType() == SourceType.FILE && !hasText(request.extractedText())) {
      throw new ExtractionFailureException("No text could be extracted from the uploaded file");
    }
    if (request.sourceType() == SourceType.URL
        && !hasText(request.sourceUrl())
        && !hasText(request.extractedText())) {
      throw new ExtractionFailureException("A URL document needs a source URL or extracted text");
    }
  }

  /** Extracted text when present, otherwise the not-yet-fetched URL. */
  private String hashInput(IngestionRequest request) {
    return hasText(request.extractedText()) ? request.extractedText() : request.sourceUrl().strip();
  }

  private void rejectDuplicates(String contentHash, DocumentScope scope, IngestionRequest request) {
    List<KnowledgeDocument> matches = knowledgeStore.findByContentHash(contentHash, scope);
    if (matches.isEmpty()) {
      return;
    }

    Optional<KnowledgeDocument> canonical =
        request.adminManaged()
            ? Optional.empty()
            : matches.stream().filter(KnowledgeDocument::isAdminManaged).findFirst();
    if (canonical.isPresent()) {
      throw duplicate(
          canonical.get(),
          "This document already exists in the admin-managed knowledge base: '"
              + canonical.get().getTitle()
              + "'");
    }

    Optional<KnowledgeDocument> own =
        matches.stream().filter(d -> request.owner().equals(d.getUploadedBy())).findFirst();
    if (own.isPresent()) {
      throw duplicate(
          own.get(), "You have already uploaded this document: '" + own.get().getTitle() + "'");
    }
  }

  private DuplicateDocumentException duplicate(KnowledgeDocument existing, String message) {
    meterRegistry.counter("knowledge.document.duplicate").increment();
    log.info("Rejected duplicate of document {} for owner", existing.getId());
    return new DuplicateDocumentException(existing.getId(), message);
  }

  private int effectivePriority(IngestionRequest request) {
    int requested =
        request.priority() != null
            ? request.priority()
            : ragConfig.getIngestion().getDefaultPriority();
    if (request.adminManaged()) {
      return requested;
    }
    return Math.max(
        KnowledgeDocument.MIN_PRIORITY, requested - ragConfig.getIngestion().getUserPriorityPenalty());
  }

  private static Set<String> copy(Set<String> values) {
    return values == null ? new LinkedHashSet<>() : new LinkedHashSet<>(values);
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
