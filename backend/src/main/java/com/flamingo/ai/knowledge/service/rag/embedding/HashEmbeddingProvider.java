package com.flamingo.ai.knowledge.service.rag.embedding;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic local {@link EmbeddingProvider} used when the remote provider fails.
 *
 * <p>Each lower-cased token is hashed into one of {@code dimensions} buckets with a sign taken
 * from the same hash, and the resulting vector is L2-normalized. Texts sharing vocabulary get a
 * positive cosine similarity, and the same text always yields the same vector. Text without any
 * token yields the zero vector.
 */
public class HashEmbeddingProvider implements EmbeddingProvider {

  private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{Nd}]+");

  private final int dimensions;

  public HashEmbeddingProvider(int dimensions) {
    if (dimensions <= 0) {
      throw new IllegalArgumentException("dimensions must be positive: " + dimensions);
    }
    this.dimensions = dimensions;
  }

  @Override
  public String modelId() {
    return "local:token-hash-" + dimensions;
  }

  @Override
  public boolean isAvailable() {
    return true;
  }

  @Override
  public float[] embed(String text) {
    float[] vector = new float[dimensions];
    if (text == null || text.isBlank()) {
      return vector;
    }

    MessageDigest digest = newDigest();
    for (String token : TOKEN_SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
      if (token.isEmpty()) {
        continue;
      }
      byte[] hash = digest.digest(token.getBytes(StandardCharsets.UTF_8));
      int bucket =
          Math.floorMod(
              ((hash[0] & 0xff) << 24)
                  | ((hash[1] & 0xff) << 16)
                  | ((hash[2] & 0xff) << 8)
                  | (hash[3] & 0xff),
              dimensions);
      vector[bucket] += (hash[4] & 1) == 0 ? 1.0f : -1.0f;
    }

    double norm = 0.0;
    for (float v : vector) {
      norm += v * v;
    }
    if (norm == 0.0) {
      return vector;
    }
    float inverse = (float) (1.0 / Math.sqrt(norm));
    for (int i = 0; i < vector.length; i++) {
      vector[i] *= inverse;
    }
    return vector;
  }

  private static MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance("MD5");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("MD5 not available", e);
    }
  }
}
