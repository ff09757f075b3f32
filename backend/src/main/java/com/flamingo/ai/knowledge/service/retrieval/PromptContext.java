package com.flamingo.ai.knowledge.service.retrieval;

import java.util.List;
import java.util.UUID;

/**
 * Retrieved text for a generation prompt.
 *
 * @param contextText the included chunks, each under a {@code === From: title (type) ===} header
 * @param sources the documents behind the included chunks, in rank order
 * @param tokenCount words used out of the budget
 */
public record PromptContext(String contextText, List<Source> sources, int tokenCount) {

  public static PromptContext empty() {
    return new PromptContext("", List.of(), 0);
  }

  public boolean isEmpty() {
    return sources.isEmpty();
  }

  /** One included chunk's document, with similarity rounded to three decimals. */
  public record Source(UUID documentId, String title, double similarity) {}
}
