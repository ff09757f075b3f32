package com.flamingo.ai.knowledge.service.rag.embedding;

import java.util.Objects;

/**
 * Pair of providers used by {@link EmbeddingService}: the primary one is tried first, the
 * fallback must never fail and is used whenever the primary is unavailable or throws.
 */
public record EmbeddingStrategy(EmbeddingProvider primary, EmbeddingProvider fallback) {

  public EmbeddingStrategy {
    Objects.requireNonNull(primary, "primary");
    Objects.requireNonNull(fallback, "fallback");
  }
}
