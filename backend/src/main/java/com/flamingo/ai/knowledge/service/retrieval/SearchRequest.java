package com.flamingo.ai.knowledge.service.retrieval;

import com.flamingo.ai.knowledge.domain.enums.KnowledgeDocumentType;
import lombok.Builder;

/**
 * A similarity search. Null {@code topK} and {@code minSimilarity} take the configured defaults;
 * null {@code visibility} means admin-managed documents only.
 */
@Builder
public record SearchRequest(
    String query,
    String targetFunction,
    String targetPlatform,
    KnowledgeDocumentType docType,
    Integer topK,
    Double minSimilarity,
    Visibility visibility) {}
