package com.flamingo.ai.knowledge.config;

import com.flamingo.ai.knowledge.service.rag.embedding.EmbeddingStrategy;
import com.flamingo.ai.knowledge.service.rag.embedding.HashEmbeddingProvider;
import com.flamingo.ai.knowledge.service.rag.embedding.LangChain4jEmbeddingProvider;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for embedding providers. The remote LangChain4j model is selected by {@code
 * rag.embedding.provider}; the hash fallback is always present.
 */
@Configuration
@Slf4j
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.embedding-model.dimensions:1536}")
  private int embeddingDimensions;

  @Bean
  @ConditionalOnProperty(
      prefix = "rag.embedding",
      name = "provider",
      havingValue = "openai",
      matchIfMissing = true)
  public EmbeddingModel embeddingModel(RagConfig ragConfig) {
    validateApiKey();

    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .modelName(embeddingModelName)
        .dimensions(embeddingDimensions)
        .timeout(Duration.ofSeconds(ragConfig.getEmbedding().getTimeoutSeconds()))
        .build();
  }

  @Bean
  @ConditionalOnProperty(prefix = "rag.embedding", name = "provider", havingValue = "ollama")
  public EmbeddingModel ollamaEmbeddingModel(RagConfig ragConfig) {
    RagConfig.Embedding.Ollama ollama = ragConfig.getEmbedding().getOllama();
    return OllamaEmbeddingModel.builder()
        .baseUrl(ollama.getBaseUrl())
        .modelName(ollama.getModelName())
        .timeout(Duration.ofSeconds(ragConfig.getEmbedding().getTimeoutSeconds()))
        .build();
  }

  @Bean
  public LangChain4jEmbeddingProvider remoteEmbeddingProvider(
      ObjectProvider<EmbeddingModel> embeddingModel, RagConfig ragConfig) {
    EmbeddingModel model = embeddingModel.getIfAvailable();
    if (model == null) {
      log.warn("No remote embedding model configured, running on the local fallback only");
    }
    return new LangChain4jEmbeddingProvider(model, remoteModelId(ragConfig));
  }

  @Bean
  public HashEmbeddingProvider fallbackEmbeddingProvider(RagConfig ragConfig) {
    return new HashEmbeddingProvider(ragConfig.getEmbedding().getFallbackDimensions());
  }

  @Bean
  public EmbeddingStrategy embeddingStrategy(
      LangChain4jEmbeddingProvider remoteEmbeddingProvider,
      HashEmbeddingProvider fallbackEmbeddingProvider) {
    return new EmbeddingStrategy(remoteEmbeddingProvider, fallbackEmbeddingProvider);
  }

  private String remoteModelId(RagConfig ragConfig) {
    String provider = ragConfig.getEmbedding().getProvider();
    if ("ollama".equalsIgnoreCase(provider)) {
      return "ollama:" + ragConfig.getEmbedding().getOllama().getModelName();
    }
    if ("local".equalsIgnoreCase(provider)) {
      return "none";
    }
    return "openai:" + embeddingModelName;
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY or rag.embedding.provider=local.");
    }
  }
}
