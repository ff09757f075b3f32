package com.flamingo.ai.knowledge.domain.repository;

import com.flamingo.ai.knowledge.domain.entity.KnowledgeDocument;
import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for KnowledgeDocument entities. */
@Repository
public interface KnowledgeDocumentRepository extends JpaRepository<KnowledgeDocument, UUID> {

  /** Finds active documents with the given content hash, admin-managed ones first. */
  @Query(
      "SELECT d FROM KnowledgeDocument d WHERE d.contentHash = :hash AND d.active = true "
          + "ORDER BY d.adminManaged DESC, d.createdAt ASC")
  List<KnowledgeDocument> findActiveByContentHash(@Param("hash") String hash);

  /** Finds active documents in the given status. */
  List<KnowledgeDocument> findByStatusAndActiveTrue(DocumentStatus status);

  /** Finds documents by status, oldest first. */
  List<KnowledgeDocument> findByStatusOrderByCreatedAtAsc(DocumentStatus status);

  /** Finds a user's own documents, newest first. */
  List<KnowledgeDocument> findByUploadedByAndAdminManagedFalseOrderByCreatedAtDesc(
      String uploadedBy);

  /** Finds all documents, newest first. */
  List<KnowledgeDocument> findAllByOrderByCreatedAtDesc();

  /** Counts documents by status. */
  long countByStatus(DocumentStatus status);

  /**
   * Moves a document to {@code target} only if its current status is one of {@code expected}.
   *
   * @return number of rows updated, 0 when the guard did not hold
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE KnowledgeDocument d SET d.status = :target, d.updatedAt = :now "
          + "WHERE d.id = :id AND d.status IN :expected")
  int compareAndSetStatus(
      @Param("id") UUID id,
      @Param("expected") Collection<DocumentStatus> expected,
      @Param("target") DocumentStatus target,
      @Param("now") LocalDateTime now);

  /** Increments usage statistics for the given documents. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE KnowledgeDocument d SET d.usageCount = d.usageCount + 1, d.lastUsedAt = :now "
          + "WHERE d.id IN :ids")
  int incrementUsage(@Param("ids") Collection<UUID> ids, @Param("now") LocalDateTime now);

  /** Sums usage across all documents. */
  @Query("SELECT COALESCE(SUM(d.usageCount), 0) FROM KnowledgeDocument d")
  long sumUsage();

  /** Counts documents grouped by type. */
  @Query("SELECT d.docType, COUNT(d) FROM KnowledgeDocument d GROUP BY d.docType")
  List<Object[]> countGroupedByType();

  /** Counts documents grouped by status. */
  @Query("SELECT d.status, COUNT(d) FROM KnowledgeDocument d GROUP BY d.status")
  List<Object[]> countGroupedByStatus();
}
