package com.flamingo.ai.knowledge.service.retrieval;

import com.flamingo.ai.knowledge.domain.enums.KnowledgeDocumentType;
import java.util.Set;
import java.util.UUID;

/**
 * A ranked chunk.
 *
 * @param similarity cosine similarity between query and chunk
 * @param score {@code similarity * priority / 10}, the ranking key
 */
public record SearchResult(
    UUID chunkId,
    UUID documentId,
    String documentTitle,
    KnowledgeDocumentType docType,
    String content,
    double similarity,
    int priority,
    Set<String> tags,
    double score,
    int tokenCount) {}
