package com.flamingo.ai.knowledge.service.retrieval;

import com.flamingo.ai.knowledge.domain.enums.KnowledgeDocumentType;
import lombok.Builder;

/** Input of prompt context assembly; null {@code maxTokens} takes the configured default. */
@Builder
public record ContextRequest(
    String query,
    String targetFunction,
    String targetPlatform,
    KnowledgeDocumentType docType,
    Visibility visibility,
    Integer maxTokens) {}
