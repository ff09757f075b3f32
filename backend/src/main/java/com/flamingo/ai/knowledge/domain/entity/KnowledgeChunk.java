package com.flamingo.ai.knowledge.domain.entity;

import com.flamingo.ai.knowledge.domain.converter.FloatArrayConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A bounded slice of a document's text together with its embedding. */
@Entity
@Table(
    name = "knowledge_chunks",
    indexes = @Index(name = "idx_knowledge_chunk_document", columnList = "document_id"),
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_knowledge_chunk_index",
            columnNames = {"document_id", "chunk_index"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class KnowledgeChunk {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "document_id", nullable = false)
  private UUID documentId;

  @Column(name = "chunk_index", nullable = false)
  private int chunkIndex;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String content;

  /** Approximate word count, used for context budget accounting. */
  @Column(name = "token_count", nullable = false)
  private int tokenCount;

  @Convert(converter = FloatArrayConverter.class)
  @Column(columnDefinition = "TEXT")
  private float[] embedding;

  /** Which embedding strategy produced {@link #embedding}. */
  @Column(name = "embedding_model", length = 200)
  private String embeddingModel;

  /** Offset of the chunk's first character in the normalized source text. */
  @Column(name = "start_char", nullable = false)
  private int startChar;

  /** Offset one past the chunk's last character in the normalized source text. */
  @Column(name = "end_char", nullable = false)
  private int endChar;
}
