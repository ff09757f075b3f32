package com.flamingo.ai.knowledge.domain.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Base64;

/**
 * JPA converter storing an embedding vector as Base64-encoded little-endian float32 bytes.
 *
 * <p>Keeps the column portable across SQLite and H2, neither of which has a vector type.
 */
@Converter
public class FloatArrayConverter implements AttributeConverter<float[], String> {

  @Override
  public String convertToDatabaseColumn(float[] attribute) {
    if (attribute == null || attribute.length == 0) {
      return null;
    }
    ByteBuffer buffer = ByteBuffer.allocate(attribute.length * Float.BYTES);
    buffer.order(ByteOrder.LITTLE_ENDIAN);
    for (float value : attribute) {
      buffer.putFloat(value);
    }
    return Base64.getEncoder().encodeToString(buffer.array());
  }

  @Override
  public float[] convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return new float[0];
    }
    ByteBuffer buffer = ByteBuffer.wrap(Base64.getDecoder().decode(dbData));
    buffer.order(ByteOrder.LITTLE_ENDIAN);
    float[] vector = new float[buffer.remaining() / Float.BYTES];
    for (int i = 0; i < vector.length; i++) {
      vector[i] = buffer.getFloat();
    }
    return vector;
  }
}
