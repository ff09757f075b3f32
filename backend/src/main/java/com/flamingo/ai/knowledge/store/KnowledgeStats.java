package com.flamingo.ai.knowledge.store;

import java.util.Map;

/**
 * Aggregate counters over the knowledge base.
 *
 * @param totalDocuments number of documents in any status
 * @param readyDocuments number of searchable documents
 * @param totalChunks number of stored chunks
 * @param totalUsage sum of document usage counts
 * @param byType document count per document type
 * @param byStatus document count per status
 */
public record KnowledgeStats(
    long totalDocuments,
    long readyDocuments,
    long totalChunks,
    long totalUsage,
    Map<String, Long> byType,
    Map<String, Long> byStatus) {}
