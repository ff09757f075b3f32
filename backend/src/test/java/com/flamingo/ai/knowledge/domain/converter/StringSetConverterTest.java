package com.flamingo.ai.knowledge.domain.converter;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StringSetConverterTest {

  private final StringSetConverter converter = new StringSetConverter();

  @Test
  @DisplayName("Empty and unreadable columns should load as mutable sets")
  void shouldLoadMutableSetForEmptyColumn() {
    Set<String> fromNull = converter.convertToEntityAttribute(null);
    Set<String> fromGarbage = converter.convertToEntityAttribute("not-json");

    fromNull.add("windows");
    fromGarbage.add("linux");

    assertThat(fromNull).containsExactly("windows");
    assertThat(fromGarbage).containsExactly("linux");
  }

  @Test
  @DisplayName("Stored sets should keep insertion order and stay mutable")
  void shouldKeepOrder() {
    Set<String> tags = converter.convertToEntityAttribute("[\"kql\",\"sigma\",\"kql\"]");

    tags.add("yara");

    assertThat(tags).containsExactly("kql", "sigma", "yara");
    assertThat(converter.convertToDatabaseColumn(Set.of())).isNull();
  }

  @Test
  @DisplayName("Entries should be stripped and blanks dropped before storing")
  void shouldNormalizeEntries() {
    Set<String> targets = new LinkedHashSet<>(List.of(" hunting ", "", "   ", "triage"));

    assertThat(converter.convertToDatabaseColumn(targets)).isEqualTo("[\"hunting\",\"triage\"]");
    assertThat(converter.convertToDatabaseColumn(Set.of(" "))).isNull();
  }
}
