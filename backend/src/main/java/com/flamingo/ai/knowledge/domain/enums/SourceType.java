package com.flamingo.ai.knowledge.domain.enums;

/** Where the text of a knowledge document came from. */
public enum SourceType {
  FILE,
  URL
}
