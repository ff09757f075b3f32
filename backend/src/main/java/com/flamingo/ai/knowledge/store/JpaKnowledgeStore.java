package com.flamingo.ai.knowledge.store;

import com.flamingo.ai.knowledge.domain.entity.KnowledgeChunk;
import com.flamingo.ai.knowledge.domain.entity.KnowledgeDocument;
import com.flamingo.ai.knowledge.domain.enums.DocumentScope;
import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledge.domain.repository.KnowledgeChunkRepository;
import com.flamingo.ai.knowledge.domain.repository.KnowledgeDocumentRepository;
import com.flamingo.ai.knowledge.exception.DocumentNotFoundException;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** {@link KnowledgeStore} on Spring Data JPA; each public method runs in its own transaction. */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaKnowledgeStore implements KnowledgeStore {

  private final KnowledgeDocumentRepository documentRepository;
  private final KnowledgeChunkRepository chunkRepository;

  @Override
  @Transactional
  public KnowledgeDocument createDocument(KnowledgeDocument document) {
    return documentRepository.save(document);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<KnowledgeDocument> getDocument(UUID documentId) {
    return documentRepository.findById(documentId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<KnowledgeDocument> findByContentHash(String contentHash, DocumentScope scope) {
    List<KnowledgeDocument> matches = documentRepository.findActiveByContentHash(contentHash);
    if (scope == DocumentScope.USER) {
      return matches.stream()
          .sorted(Comparator.comparing(KnowledgeDocument::isAdminManaged).reversed())
          .toList();
    }
    return matches;
  }

  @Override
  @Transactional
  public KnowledgeDocument updateDocumentStatus(
      UUID documentId, DocumentStatus status, String error) {
    KnowledgeDocument document = require(documentId);
    if (status == DocumentStatus.FAILED) {
      document.markFailed(error);
    } else {
      document.setStatus(status);
      document.setProcessingError(error);
    }
    return documentRepository.saveAndFlush(document);
  }

  @Override
  @Transactional
  public boolean compareAndSetStatus(
      UUID documentId, Set<DocumentStatus> expected, DocumentStatus target) {
    int updated =
        documentRepository.compareAndSetStatus(documentId, expected, target, LocalDateTime.now());
    return updated == 1;
  }

  @Override
  @Transactional
  public int replaceChunks(UUID documentId, List<KnowledgeChunk> chunks) {
    require(documentId);
    int removed = chunkRepository.deleteByDocumentId(documentId);
    chunks.forEach(chunk -> chunk.setDocumentId(documentId));
    chunkRepository.saveAll(chunks);
    chunkRepository.flush();
    log.debug(
        "Replaced chunks of document {}: removed {}, stored {}", documentId, removed, chunks.size());
    return chunks.size();
  }

  @Override
  @Transactional
  public KnowledgeDocument markReady(UUID documentId, int chunkCount) {
    KnowledgeDocument document = require(documentId);
    document.markReady(chunkCount);
    return documentRepository.saveAndFlush(document);
  }

  @Override
  @Transactional
  public KnowledgeDocument updateDocument(UUID documentId, Consumer<KnowledgeDocument> changes) {
    KnowledgeDocument document = require(documentId);
    changes.accept(document);
    return documentRepository.saveAndFlush(document);
  }

  @Override
  @Transactional
  public Optional<KnowledgeDocument> deleteDocumentCascade(UUID documentId) {
    Optional<KnowledgeDocument> document = documentRepository.findById(documentId);
    if (document.isEmpty()) {
      return Optional.empty();
    }
    int chunks = chunkRepository.deleteByDocumentId(documentId);
    documentRepository.deleteById(documentId);
    documentRepository.flush();
    log.debug("Deleted document {} with {} chunks", documentId, chunks);
    return document;
  }

  @Override
  @Transactional(readOnly = true)
  public List<KnowledgeChunk> listChunks(Collection<UUID> documentIds) {
    if (documentIds.isEmpty()) {
      return List.of();
    }
    return chunkRepository.findByDocumentIdInOrderByDocumentIdAscChunkIndexAsc(documentIds);
  }

  @Override
  @Transactional(readOnly = true)
  public List<KnowledgeDocument> findSearchableDocuments() {
    return documentRepository.findByStatusAndActiveTrue(DocumentStatus.READY);
  }

  @Override
  @Transactional(readOnly = true)
  public List<KnowledgeDocument> findByStatus(DocumentStatus status) {
    return documentRepository.findByStatusOrderByCreatedAtAsc(status);
  }

  @Override
  @Transactional(readOnly = true)
  public List<KnowledgeDocument> listDocuments() {
    return documentRepository.findAllByOrderByCreatedAtDesc();
  }

  @Override
  @Transactional(readOnly = true)
  public List<KnowledgeDocument> listOwnedDocuments(String owner) {
    return documentRepository.findByUploadedByAndAdminManagedFalseOrderByCreatedAtDesc(owner);
  }

  @Override
  @Transactional
  public void recordUsage(Collection<UUID> documentIds) {
    if (documentIds.isEmpty()) {
      return;
    }
    documentRepository.incrementUsage(documentIds, LocalDateTime.now());
  }

  @Override
  @Transactional(readOnly = true)
  public List<UUID> findDocumentIdsWithStaleEmbeddings(String modelId) {
    return chunkRepository.findDocumentIdsWithEmbeddingModelOtherThan(modelId);
  }

  @Override
  @Transactional(readOnly = true)
  public KnowledgeStats stats() {
    return new KnowledgeStats(
        documentRepository.count(),
        documentRepository.countByStatus(DocumentStatus.READY),
        chunkRepository.count(),
        documentRepository.sumUsage(),
        toCountMap(documentRepository.countGroupedByType()),
        toCountMap(documentRepository.countGroupedByStatus()));
  }

  private KnowledgeDocument require(UUID documentId) {
    return documentRepository
        .findById(documentId)
        .orElseThrow(() -> new DocumentNotFoundException(documentId));
  }

  private static Map<String, Long> toCountMap(List<Object[]> rows) {
    Map<String, Long> counts = new TreeMap<>();
    for (Object[] row : rows) {
      counts.put(String.valueOf(row[0]), ((Number) row[1]).longValue());
    }
    return counts;
  }
}
