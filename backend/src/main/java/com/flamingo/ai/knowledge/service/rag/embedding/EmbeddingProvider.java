package com.flamingo.ai.knowledge.service.rag.embedding;

/**
 * Produces a fixed-dimension vector for a piece of text.
 *
 * <p>Implementations may block on I/O and may throw; {@link EmbeddingService} decides what to do
 * on failure.
 */
public interface EmbeddingProvider {

  /** Identifier recorded on every chunk embedded by this provider, e.g. {@code openai:model}. */
  String modelId();

  /** Whether the provider is configured and may be called. */
  boolean isAvailable();

  /**
   * Embeds already-truncated text.
   *
   * @param text the input, at most the configured maximum length
   * @return the embedding vector
   */
  float[] embed(String text);
}
