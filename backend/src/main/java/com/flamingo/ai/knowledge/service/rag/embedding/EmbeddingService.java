package com.flamingo.ai.knowledge.service.rag.embedding;

import com.flamingo.ai.knowledge.config.RagConfig;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Generates embeddings for chunks and queries.
 *
 * <p>Never fails because of the remote provider: when it is unavailable, throws, or returns an
 * empty vector, the deterministic fallback of the {@link EmbeddingStrategy} is used and the
 * result's model id says so.
 */
@Service
@Slf4j
public class EmbeddingService {

  private final EmbeddingStrategy strategy;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  public EmbeddingService(
      EmbeddingStrategy strategy, RagConfig ragConfig, MeterRegistry meterRegistry) {
    this.strategy = strategy;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Embeds text, falling back to the local strategy on any remote failure.
   *
   * @param text the text to embed
   * @return vector and producing model id
   */
  @Timed(value = "embedding.embed", description = "Time to embed text")
  public EmbeddingResult embed(String text) {
    String input = truncate(text == null ? "" : text);
    EmbeddingProvider primary = strategy.primary();

    if (primary.isAvailable()) {
      try {
        float[] vector = primary.embed(input);
        if (vector != null && vector.length > 0) {
          meterRegistry.counter("embedding.requests.success").increment();
          return new EmbeddingResult(vector, primary.modelId(), false);
        }
        log.warn("Embedding provider {} returned an empty vector, using fallback", primary.modelId());
      } catch (RuntimeException e) {
        log.warn(
            "Embedding provider {} unavailable, using fallback: {}",
            primary.modelId(),
            e.getMessage());
      }
      meterRegistry.counter("embedding.requests.failure").increment();
    }

    return embedWithFallback(input);
  }

  /**
   * Embeds text with the provider identified by {@code modelId}, used to score chunks produced by
   * a different strategy than the current query vector. Only the local fallback can be reproduced
   * on demand.
   *
   * @return the embedding, or empty if {@code modelId} is not the fallback's
   */
  public Optional<EmbeddingResult> embedForModel(String modelId, String text) {
    if (!strategy.fallback().modelId().equals(modelId)) {
      return Optional.empty();
    }
    return Optional.of(embedWithFallback(truncate(text == null ? "" : text)));
  }

  /** Model id that new embeddings are expected to carry when the system is healthy. */
  public String activeModelId() {
    EmbeddingProvider primary = strategy.primary();
    return primary.isAvailable() ? primary.modelId() : strategy.fallback().modelId();
  }

  /** Model id of the deterministic fallback. */
  public String fallbackModelId() {
    return strategy.fallback().modelId();
  }

  /** Whether a remote provider is configured. */
  public boolean isRemoteAvailable() {
    return strategy.primary().isAvailable();
  }

  private EmbeddingResult embedWithFallback(String input) {
    EmbeddingProvider fallback = strategy.fallback();
    meterRegistry.counter("embedding.fallback").increment();
    return new EmbeddingResult(fallback.embed(input), fallback.modelId(), true);
  }

  private String truncate(String text) {
    int maxChars = ragConfig.getEmbedding().getMaxInputChars();
    if (text.length() <= maxChars) {
      return text;
    }
    log.debug("Input too long for embedding, truncating from {} to {} chars", text.length(), maxChars);
    return text.substring(0, maxChars);
  }
}
