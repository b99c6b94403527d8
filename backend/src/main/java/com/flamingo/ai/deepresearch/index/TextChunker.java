package com.flamingo.ai.deepresearch.index;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits evidence text into overlapping character windows, preferring to cut at whitespace.
 * Stateless and safe for concurrent use.
 */
public class TextChunker {

  private final int chunkSize;
  private final int overlap;

  public TextChunker(int chunkSize, int overlap) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive");
    }
    if (overlap < 0 || overlap >= chunkSize) {
      throw new IllegalArgumentException("overlap must be in [0, chunkSize)");
    }
    this.chunkSize = chunkSize;
    this.overlap = overlap;
  }

  public List<String> split(String text) {
    List<String> chunks = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return chunks;
    }
    String normalized = text.strip();
    if (normalized.length() <= chunkSize) {
      chunks.add(normalized);
      return chunks;
    }

    int start = 0;
    while (start < normalized.length()) {
      int end = Math.min(start + chunkSize, normalized.length());
      if (end < normalized.length()) {
        int lastSpace = normalized.lastIndexOf(' ', end);
        if (lastSpace > start + overlap) {
          end = lastSpace;
        }
      }
      String chunk = normalized.substring(start, end).strip();
      if (!chunk.isEmpty()) {
        chunks.add(chunk);
      }
      if (end >= normalized.length()) {
        break;
      }
      start = Math.max(end - overlap, start + 1);
    }
    return chunks;
  }
}
