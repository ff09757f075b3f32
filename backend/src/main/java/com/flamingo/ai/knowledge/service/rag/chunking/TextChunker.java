package com.flamingo.ai.knowledge.service.rag.chunking;

import com.flamingo.ai.knowledge.config.RagConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits extracted text into overlapping, sentence-aligned windows.
 *
 * <p>The text is normalized first (runs of blank lines collapse to one, runs of spaces to one
 * space). Each window is {@code chunkSize} characters long unless a sentence boundary is found in
 * its second half, in which case the window ends just after that boundary. The next window starts
 * {@code overlap} characters before the previous end; the window reaching the end of the text is
 * the last one.
 *
 * <p>Output depends only on {@code (text, chunkSize, overlap)}, so reprocessing unchanged text
 * reproduces the same boundaries. Stateless and safe for concurrent use.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TextChunker {

  private static final String[] SENTENCE_BOUNDARIES = {". ", ".\n", "!\n", "?\n", "\n\n"};
  private static final Pattern BLANK_LINES = Pattern.compile("\n{3,}");
  private static final Pattern SPACES = Pattern.compile(" {2,}");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final RagConfig ragConfig;

  /** Chunks with the configured size and overlap. */
  public List<TextChunk> chunk(String text) {
    RagConfig.Chunking chunking = ragConfig.getChunking();
    return chunk(text, chunking.getSize(), chunking.getOverlap());
  }

  /**
   * Chunks {@code text}.
   *
   * @param text extracted text, may be null
   * @param chunkSize window size in characters, positive
   * @param overlap characters shared by consecutive windows, in {@code [0, chunkSize)}
   * @return ordered chunks; empty if the text has no non-blank content
   */
  public List<TextChunk> chunk(String text, int chunkSize, int overlap) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
    }
    if (overlap < 0 || overlap >= chunkSize) {
      throw new IllegalArgumentException(
          "overlap must be in [0, chunkSize): overlap=" + overlap + ", chunkSize=" + chunkSize);
    }
    if (text == null || text.isEmpty()) {
      return List.of();
    }

    String normalized = normalize(text);
    int length = normalized.length();
    int minBoundary = (int) (chunkSize * ragConfig.getChunking().getMinBoundaryRatio());

    List<TextChunk> chunks = new ArrayList<>();
    int start = 0;
    while (start < length) {
      int end = Math.min(start + chunkSize, length);
      if (start + chunkSize < length) {
        end = snapToSentenceBoundary(normalized, start, start + chunkSize, minBoundary);
      }

      String content = normalized.substring(start, end).strip();
      if (!content.isEmpty()) {
        chunks.add(
            new TextChunk(chunks.size(), content, start, end, WHITESPACE.split(content).length));
      }

      if (end >= length) {
        break;
      }
      start = Math.max(end - overlap, start + 1);
    }

    log.debug(
        "Chunked {} chars into {} chunks (size={}, overlap={})",
        length,
        chunks.size(),
        chunkSize,
        overlap);
    return chunks;
  }

  /** Collapses three or more newlines to two and runs of spaces to one. */
  static String normalize(String text) {
    String collapsed = BLANK_LINES.matcher(text).replaceAll("\n\n");
    return SPACES.matcher(collapsed).replaceAll(" ");
  }

  /**
   * Returns the end offset just after the boundary nearest to {@code naiveEnd}, or {@code
   * naiveEnd} when no boundary lies beyond {@code minBoundary} characters into the window.
   */
  private static int snapToSentenceBoundary(
      String text, int start, int naiveEnd, int minBoundary) {
    String window = text.substring(start, naiveEnd);
    int best = -1;
    for (String boundary : SENTENCE_BOUNDARIES) {
      int position = window.lastIndexOf(boundary);
      if (position > minBoundary) {
        best = Math.max(best, start + position + boundary.length());
      }
    }
    return best > 0 ? best : naiveEnd;
  }
}
