package com.flamingo.ai.knowledge.service.rag.embedding;

/**
 * An embedding vector together with the model that produced it.
 *
 * @param vector the embedding
 * @param modelId identifier of the producing {@link EmbeddingProvider}
 * @param fallback true if the deterministic local fallback produced the vector
 */
public record EmbeddingResult(float[] vector, String modelId, boolean fallback) {

  public boolean isEmpty() {
    return vector == null || vector.length == 0;
  }
}
