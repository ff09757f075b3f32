package com.flamingo.ai.knowledge.domain.enums;

/** Visibility tier of a knowledge document. */
public enum DocumentScope {
  /** Organization-wide knowledge, visible to every caller. */
  GLOBAL,

  /** Personal knowledge, visible only to its uploader. */
  USER
}
