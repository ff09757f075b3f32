package com.flamingo.ai.knowledge.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * JPA converter storing tags and target function/platform sets as a JSON array in a TEXT column.
 * Entries are stripped and blanks dropped in both directions, since they are matched verbatim
 * against search filters. Loaded sets are always mutable and keep insertion order.
 */
@Converter
@Slf4j
public class StringSetConverter implements AttributeConverter<Set<String>, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<List<String>> ENTRIES = new TypeReference<>() {};

  @Override
  public String convertToDatabaseColumn(Set<String> attribute) {
    Set<String> entries = normalize(attribute);
    if (entries.isEmpty()) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(entries);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot serialize set " + entries, e);
    }
  }

  @Override
  public Set<String> convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return new LinkedHashSet<>();
    }
    try {
      return normalize(MAPPER.readValue(dbData, ENTRIES));
    } catch (JsonProcessingException e) {
      log.error("Unreadable set column, loading it empty: {}", e.getMessage());
      return new LinkedHashSet<>();
    }
  }

  private static Set<String> normalize(Collection<String> values) {
    Set<String> entries = new LinkedHashSet<>();
    if (values == null) {
      return entries;
    }
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        entries.add(value.strip());
      }
    }
    return entries;
  }
}
