package com.flamingo.ai.knowledge.service.retrieval;

import com.flamingo.ai.knowledge.config.RagConfig;
import com.flamingo.ai.knowledge.domain.entity.KnowledgeChunk;
import com.flamingo.ai.knowledge.domain.entity.KnowledgeDocument;
import com.flamingo.ai.knowledge.service.rag.embedding.EmbeddingResult;
import com.flamingo.ai.knowledge.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.knowledge.service.rag.embedding.VectorMath;
import com.flamingo.ai.knowledge.store.KnowledgeStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Ranks chunks of eligible documents by priority-weighted cosine similarity and assembles prompt
 * context under a token budget.
 *
 * <p>Chunks are scored with a linear scan over the eligible documents. A chunk is only compared
 * with a query vector from the same embedding model: the query's own model, or the local fallback
 * recomputed on demand. Chunks from any other model score zero.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KnowledgeRetrievalService {

  private final KnowledgeStore knowledgeStore;
  private final EmbeddingService embeddingService;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Searches the knowledge base. Returns an empty list rather than failing when the query cannot
   * be embedded.
   */
  @Timed(value = "knowledge.search", description = "Time to search the knowledge base")
  public List<SearchResult> search(SearchRequest request) {
    meterRegistry.counter("knowledge.search.requests").increment();
    if (request.query() == null || request.query().isBlank()) {
      return List.of();
    }
    int topK = request.topK() != null ? request.topK() : ragConfig.getRetrieval().getTopK();
    double minSimilarity =
        request.minSimilarity() != null
            ? request.minSimilarity()
            : ragConfig.getRetrieval().getMinSimilarity();
    if (topK <= 0) {
      return List.of();
    }

    EmbeddingResult queryEmbedding;
    try {
      queryEmbedding = embeddingService.embed(request.query());
    } catch (RuntimeException e) {
      return degraded(e.getMessage());
    }
    if (queryEmbedding == null || queryEmbedding.isEmpty()) {
      return degraded("empty query vector");
    }

    Visibility visibility =
        request.visibility() != null ? request.visibility() : Visibility.adminManagedOnly();
    Map<UUID, KnowledgeDocument> eligible =
        knowledgeStore.findSearchableDocuments().stream()
            .filter(d -> request.docType() == null || request.docType() == d.getDocType())
            .filter(visibility::permits)
            .filter(d -> d.appliesTo(request.targetFunction(), request.targetPlatform()))
            .collect(Collectors.toMap(KnowledgeDocument::getId, Function.identity()));
    if (eligible.isEmpty()) {
      log.debug("No eligible documents for query");
      return List.of();
    }

    QueryVectors queryVectors = new QueryVectors(request.query(), queryEmbedding);
    List<SearchResult> scored = new ArrayList<>();
    for (KnowledgeChunk chunk : knowledgeStore.listChunks(eligible.keySet())) {
      KnowledgeDocument document = eligible.get(chunk.getDocumentId());
      if (document == null) {
        continue;
      }
      float[] queryVector = queryVectors.forModel(chunk.getEmbeddingModel());
      double similarity =
          queryVector == null ? 0.0 : VectorMath.cosineSimilarity(queryVector, chunk.getEmbedding());
      if (similarity < minSimilarity) {
        continue;
      }
      scored.add(toResult(chunk, document, similarity));
    }

    List<SearchResult> results =
        scored.stream()
            .sorted(
                Comparator.comparingDouble(SearchResult::score)
                    .thenComparingDouble(SearchResult::similarity)
                    .reversed())
            .limit(topK)
            .toList();

    recordUsage(results);
    log.debug(
        "Search over {} documents returned {} of {} matching chunks",
        eligible.size(),
        results.size(),
        scored.size());
    return results;
  }

  /**
   * Concatenates search results in rank order until the next one would exceed the token budget.
   * The included chunks are always a prefix of the ranked results.
   */
  @Timed(value = "knowledge.context", description = "Time to assemble prompt context")
  public PromptContext getContextForPrompt(ContextRequest request) {
    int maxTokens =
        request.maxTokens() != null
            ? request.maxTokens()
            : ragConfig.getRetrieval().getDefaultMaxTokens();

    List<SearchResult> results =
        search(
            SearchRequest.builder()
                .query(request.query())
                .targetFunction(request.targetFunction())
                .targetPlatform(request.targetPlatform())
                .docType(request.docType())
                .topK(ragConfig.getRetrieval().getContextCandidates())
                .visibility(
                    request.visibility() != null
                        ? request.visibility()
                        : Visibility.adminManagedOnly())
                .build());
    if (results.isEmpty()) {
      return PromptContext.empty();
    }

    List<String> parts = new ArrayList<>();
    List<PromptContext.Source> sources = new ArrayList<>();
    int totalTokens = 0;
    for (SearchResult result : results) {
      if (totalTokens + result.tokenCount() > maxTokens) {
        break;
      }
      parts.add(
          "=== From: "
              + result.documentTitle()
              + " ("
              + result.docType().name()
              + ") ===\n"
              + result.content());
      sources.add(
          new PromptContext.Source(
              result.documentId(),
              result.documentTitle(),
              Math.round(result.similarity() * 1000) / 1000.0));
      totalTokens += result.tokenCount();
    }

    log.debug(
        "Assembled context from {} of {} results, {} tokens",
        sources.size(),
        results.size(),
        totalTokens);
    return new PromptContext(String.join("\n\n", parts), List.copyOf(sources), totalTokens);
  }

  private SearchResult toResult(KnowledgeChunk chunk, KnowledgeDocument document, double sim) {
    Set<String> tags =
        document.getTags() == null ? Set.of() : new LinkedHashSet<>(document.getTags());
    return new SearchResult(
        chunk.getId(),
        document.getId(),
        document.getTitle(),
        document.getDocType(),
        chunk.getContent(),
        sim,
        document.getPriority(),
        tags,
        sim * document.getPriority() / 10.0,
        chunk.getTokenCount());
  }

  private void recordUsage(List<SearchResult> results) {
    if (results.isEmpty()) {
      return;
    }
    Set<UUID> documentIds = new LinkedHashSet<>();
    results.forEach(r -> documentIds.add(r.documentId()));
    try {
      knowledgeStore.recordUsage(documentIds);
    } catch (DataAccessException e) {
      log.warn("Failed to update usage stats for {} documents: {}", documentIds.size(), e.getMessage());
    }
  }

  private List<SearchResult> degraded(String reason) {
    meterRegistry.counter("knowledge.search.degraded").increment();
    log.warn("Query embedding failed, returning no results: {}", reason);
    return List.of();
  }

  /** Query vectors per embedding model, computed at most once per search. */
  private final class QueryVectors {

    private final String query;
    private final Map<String, float[]> byModel = new HashMap<>();

    QueryVectors(String query, EmbeddingResult primary) {
      this.query = query;
      byModel.put(primary.modelId(), primary.vector());
    }

    float[] forModel(String modelId) {
      if (modelId == null) {
        return null;
      }
      return byModel.computeIfAbsent(
          modelId,
          model ->
              embeddingService
                  .embedForModel(model, query)
                  .map(EmbeddingResult::vector)
                  .orElse(null));
    }
  }
}
