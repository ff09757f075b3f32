package com.flamingo.ai.knowledge.domain.repository;

import com.flamingo.ai.knowledge.domain.entity.KnowledgeChunk;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for KnowledgeChunk entities. */
@Repository
public interface KnowledgeChunkRepository extends JpaRepository<KnowledgeChunk, UUID> {

  /** Finds the chunks of the given documents. */
  List<KnowledgeChunk> findByDocumentIdInOrderByDocumentIdAscChunkIndexAsc(
      Collection<UUID> documentIds);

  /** Deletes every chunk of a document. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("DELETE FROM KnowledgeChunk c WHERE c.documentId = :documentId")
  int deleteByDocumentId(@Param("documentId") UUID documentId);

  /** Finds documents with at least one chunk embedded by a model other than {@code model}. */
  @Query(
      "SELECT DISTINCT c.documentId FROM KnowledgeChunk c "
          + "WHERE c.embeddingModel IS NULL OR c.embeddingModel <> :model")
  List<UUID> findDocumentIdsWithEmbeddingModelOtherThan(@Param("model") String model);
}
