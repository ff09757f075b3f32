package com.flamingo.ai.knowledge.service.rag.chunking;

/**
 * A single chunk produced by {@link TextChunker}, before embedding.
 *
 * @param index sequential position within the document (0-based)
 * @param content the trimmed, non-empty chunk text
 * @param startChar offset of the window start in the normalized text
 * @param endChar offset one past the window end in the normalized text
 * @param tokenCount whitespace-separated word count of {@code content}
 */
public record TextChunk(int index, String content, int startChar, int endChar, int tokenCount) {}
