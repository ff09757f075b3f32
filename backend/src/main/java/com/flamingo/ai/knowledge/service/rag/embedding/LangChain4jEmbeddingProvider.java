package com.flamingo.ai.knowledge.service.rag.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;

/**
 * Remote {@link EmbeddingProvider} backed by a LangChain4j {@link EmbeddingModel} (OpenAI or
 * Ollama). The HTTP timeout is set on the model itself.
 */
@Slf4j
public class LangChain4jEmbeddingProvider implements EmbeddingProvider {

  private final EmbeddingModel embeddingModel;
  private final String modelId;

  /**
   * @param embeddingModel the model, or null when no remote provider is configured
   * @param modelId identifier recorded on produced vectors
   */
  public LangChain4jEmbeddingProvider(EmbeddingModel embeddingModel, String modelId) {
    this.embeddingModel = embeddingModel;
    this.modelId = modelId;
  }

  @Override
  public String modelId() {
    return modelId;
  }

  @Override
  public boolean isAvailable() {
    return embeddingModel != null;
  }

  @Override
  @CircuitBreaker(name = "embedding")
  @Retry(name = "embedding")
  public float[] embed(String text) {
    if (embeddingModel == null) {
      throw new IllegalStateException("No remote embedding model configured");
    }
    log.debug("Calling remote embedding model {} for {} chars", modelId, text.length());
    Response<Embedding> response = embeddingModel.embed(text);
    return response.content().vector();
  }
}
