package com.flamingo.ai.knowledge.service.lifecycle;

import com.flamingo.ai.knowledge.domain.entity.KnowledgeDocument;
import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledge.exception.DocumentNotFoundException;
import com.flamingo.ai.knowledge.exception.DocumentStateConflictException;
import com.flamingo.ai.knowledge.service.processing.CancellationRegistry;
import com.flamingo.ai.knowledge.service.processing.DocumentProcessingService;
import com.flamingo.ai.knowledge.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.knowledge.store.KnowledgeStats;
import com.flamingo.ai.knowledge.store.KnowledgeStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/** Implementation of the DocumentLifecycleService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentLifecycleServiceImpl implements DocumentLifecycleService {

  static final String INTERRUPTED_MESSAGE = "Processing interrupted";

  private final KnowledgeStore knowledgeStore;
  private final DocumentProcessingService documentProcessingService;
  private final CancellationRegistry cancellationRegistry;
  private final EmbeddingService embeddingService;
  private final SourceFileStorage sourceFileStorage;
  private final MeterRegistry meterRegistry;

  @Override
  public KnowledgeDocument getDocument(UUID documentId) {
    return knowledgeStore
        .getDocument(documentId)
        .orElseThrow(() -> new DocumentNotFoundException(documentId));
  }

  @Override
  public List<KnowledgeDocument> listDocuments(DocumentFilter filter) {
    DocumentFilter criteria = filter != null ? filter : DocumentFilter.all();
    Stream<KnowledgeDocument> documents =
        knowledgeStore.listDocuments().stream().filter(criteria::matches);
    if (criteria.limit() != null) {
      documents = documents.limit(Math.max(0, criteria.limit()));
    }
    return documents.toList();
  }

  @Override
  public List<KnowledgeDocument> listOwnedDocuments(String owner) {
    return knowledgeStore.listOwnedDocuments(owner);
  }

  @Override
  public KnowledgeDocument process(UUID documentId) {
    return documentProcessingService.process(documentId);
  }

  @Override
  @Timed(value = "knowledge.document.reprocess", description = "Time to reprocess a document")
  public KnowledgeDocument reprocess(UUID documentId) {
    KnowledgeDocument document = getDocument(documentId);
    if (document.getStatus() != DocumentStatus.PENDING) {
      boolean reset =
          knowledgeStore.compareAndSetStatus(
              documentId, DocumentStatus.REPROCESSABLE, DocumentStatus.PENDING);
      if (!reset) {
        KnowledgeDocument current = getDocument(documentId);
        throw new DocumentStateConflictException(documentId, current.getStatus(), "reprocess");
      }
    }
    log.info("Reprocessing document {} (was {})", documentId, document.getStatus());
    return documentProcessingService.process(documentId);
  }

  @Override
  public KnowledgeDocument submitForProcessing(UUID documentId) {
    KnowledgeDocument document = getDocument(documentId);
    if (!DocumentStatus.PROCESSABLE.contains(document.getStatus())) {
      throw new DocumentStateConflictException(documentId, document.getStatus(), "process");
    }
    documentProcessingService.processAsync(documentId);
    log.info("Submitted document {} for background processing", documentId);
    return document;
  }

  @Override
  public PendingSubmission processPending() {
    List<KnowledgeDocument> pending = knowledgeStore.findByStatus(DocumentStatus.PENDING);
    List<UUID> deferred = new ArrayList<>();
    int submitted = 0;
    for (KnowledgeDocument document : pending) {
      if (!deferred.isEmpty()) {
        deferred.add(document.getId());
        continue;
      }
      try {
        documentProcessingService.processAsync(document.getId());
        submitted++;
      } catch (TaskRejectedException e) {
        log.warn("Processing executor saturated at document {}", document.getId());
        deferred.add(document.getId());
      }
    }
    if (!deferred.isEmpty()) {
      meterRegistry.counter("knowledge.processing.deferred").increment(deferred.size());
    }
    log.info(
        "Submitted {} pending documents for processing, {} deferred", submitted, deferred.size());
    return new PendingSubmission(submitted, List.copyOf(deferred));
  }

  @Override
  public int recoverInterrupted() {
    int recovered = 0;
    for (KnowledgeDocument document : knowledgeStore.findByStatus(DocumentStatus.PROCESSING)) {
      if (cancellationRegistry.isRunning(document.getId())) {
        continue;
      }
      if (knowledgeStore.compareAndSetStatus(
          document.getId(), EnumSet.of(DocumentStatus.PROCESSING), DocumentStatus.FAILED)) {
        knowledgeStore.updateDocumentStatus(
            document.getId(), DocumentStatus.FAILED, INTERRUPTED_MESSAGE);
        recovered++;
      }
    }
    if (recovered > 0) {
      log.warn("Marked {} interrupted documents as FAILED", recovered);
    }
    return recovered;
  }

  @Override
  public boolean cancel(UUID documentId) {
    getDocument(documentId);
    boolean flagged = cancellationRegistry.requestCancel(documentId);
    log.info(
        "Cancellation of document {} {}",
        documentId,
        flagged ? "requested" : "ignored, no pass in flight");
    return flagged;
  }

  @Override
  public KnowledgeDocument updateDocument(UUID documentId, DocumentUpdate update) {
    if (update.title() != null && update.title().isBlank()) {
      throw new IllegalArgumentException("Title must not be blank");
    }
    Integer priority = update.priority();
    if (priority != null
        && (priority < KnowledgeDocument.MIN_PRIORITY || priority > KnowledgeDocument.MAX_PRIORITY)) {
      throw new IllegalArgumentException("Priority must be between 1 and 10: " + priority);
    }

    KnowledgeDocument updated =
        knowledgeStore.updateDocument(
            documentId,
            document -> {
              if (update.title() != null) {
                document.setTitle(update.title().strip());
              }
              if (update.description() != null) {
                document.setDescription(update.description());
              }
              if (update.targetFunctions() != null) {
                document.setTargetFunctions(new LinkedHashSet<>(update.targetFunctions()));
              }
              if (update.targetPlatforms() != null) {
                document.setTargetPlatforms(new LinkedHashSet<>(update.targetPlatforms()));
              }
              if (update.tags() != null) {
                document.setTags(new LinkedHashSet<>(update.tags()));
              }
              if (priority != null) {
                document.setPriority(priority);
              }
              if (update.active() != null) {
                document.setActive(update.active());
              }
            });
    log.info("Document {} metadata updated", documentId);
    return updated;
  }

  @Override
  @Timed(value = "knowledge.document.delete", description = "Time to delete a document")
  public void deleteDocument(UUID documentId) {
    cancellationRegistry.requestCancel(documentId);
    Optional<KnowledgeDocument> deleted = knowledgeStore.deleteDocumentCascade(documentId);
    if (deleted.isEmpty()) {
      throw new DocumentNotFoundException(documentId);
    }
    KnowledgeDocument document = deleted.get();
    if (document.getSource() != null) {
      sourceFileStorage.deleteAfterCommit(document.getSource().getFilePath());
    }
    meterRegistry.counter("knowledge.document.deleted").increment();
    log.info("Document {} deleted", documentId);
  }

  @Override
  public KnowledgeStats getStats() {
    return knowledgeStore.stats();
  }

  @Override
  public List<KnowledgeDocument> findStaleDocuments() {
    String activeModel = embeddingService.activeModelId();
    return knowledgeStore.findDocumentIdsWithStaleEmbeddings(activeModel).stream()
        .map(knowledgeStore::getDocument)
        .flatMap(Optional::stream)
        .toList();
  }
}
