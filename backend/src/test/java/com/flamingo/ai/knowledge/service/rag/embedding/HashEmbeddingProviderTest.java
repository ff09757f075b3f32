package com.flamingo.ai.knowledge.service.rag.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HashEmbeddingProvider Tests")
class HashEmbeddingProviderTest {

  private final HashEmbeddingProvider provider = new HashEmbeddingProvider(128);

  @Test
  @DisplayName("Should produce the same unit vector for the same text")
  void shouldBeDeterministic() {
    float[] first = provider.embed("Lateral movement via PsExec");
    float[] second = provider.embed("Lateral movement via PsExec");

    assertThat(first).hasSize(128).containsExactly(second);
    double norm = 0;
    for (float v : first) {
      norm += v * v;
    }
    assertThat(norm).isEqualTo(1.0, within(1e-5));
  }

  @Test
  @DisplayName("Should ignore case and punctuation")
  void shouldNormalizeTokens() {
    assertThat(provider.embed("Process Injection!")).containsExactly(provider.embed("process injection"));
  }

  @Test
  @DisplayName("Texts sharing vocabulary should be more similar than unrelated texts")
  void shouldReflectSharedVocabulary() {
    float[] query = provider.embed("kerberos ticket granting attack");
    float[] related = provider.embed("detecting kerberos golden ticket attack");
    float[] unrelated = provider.embed("quarterly marketing budget spreadsheet");

    assertThat(VectorMath.cosineSimilarity(query, related))
        .isGreaterThan(VectorMath.cosineSimilarity(query, unrelated));
  }

  @Test
  @DisplayName("Blank text should yield the zero vector")
  void shouldReturnZeroVectorForBlankText() {
    assertThat(provider.embed("  ")).hasSize(128).containsOnly(0.0f);
    assertThat(provider.embed(null)).hasSize(128).containsOnly(0.0f);
  }

  @Test
  @DisplayName("Model id should record the dimensions")
  void shouldExposeModelId() {
    assertThat(provider.modelId()).isEqualTo("local:token-hash-128");
    assertThat(provider.isAvailable()).isTrue();
    assertThatThrownBy(() -> new HashEmbeddingProvider(0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
