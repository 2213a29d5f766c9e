package com.flamingo.ai.rulesindex.service.rag.model;

/**
 * Size bounds used when segmenting a text span into chunks, in characters.
 *
 * @param targetSize preferred chunk length; spans no longer than this are emitted whole
 * @param minSize lower bound for a paragraph break to be used as a chunk end
 * @param maxSize upper bound for a chunk, except for an indivisible run of text
 * @param overlapSize characters repeated at the start of the following chunk
 * @param wordBoundaryWindow distance either side of the target size searched for whitespace
 */
public record ChunkSizes(
    int targetSize, int minSize, int maxSize, int overlapSize, int wordBoundaryWindow) {

  public static final int DEFAULT_TARGET_SIZE = 1800;
  public static final int DEFAULT_MIN_SIZE = 500;
  public static final int DEFAULT_MAX_SIZE = 2500;
  public static final int DEFAULT_OVERLAP_SIZE = 200;
  public static final int DEFAULT_WORD_BOUNDARY_WINDOW = 50;

  public ChunkSizes {
    if (minSize <= 0) {
      throw new IllegalArgumentException("minSize must be positive (got " + minSize + ")");
    }
    if (minSize >= targetSize || targetSize >= maxSize) {
      throw new IllegalArgumentException(
          "Expected minSize < targetSize < maxSize (got "
              + minSize
              + ", "
              + targetSize
              + ", "
              + maxSize
              + ")");
    }
    if (overlapSize < 0 || overlapSize >= minSize) {
      throw new IllegalArgumentException(
          "overlapSize must be >= 0 and < minSize (got " + overlapSize + ")");
    }
    if (wordBoundaryWindow < 0 || targetSize + wordBoundaryWindow > maxSize) {
      throw new IllegalArgumentException(
          "wordBoundaryWindow must be >= 0 and keep targetSize + window <= maxSize (got "
              + wordBoundaryWindow
              + ")");
    }
  }

  public static ChunkSizes defaults() {
    return new ChunkSizes(
        DEFAULT_TARGET_SIZE,
        DEFAULT_MIN_SIZE,
        DEFAULT_MAX_SIZE,
        DEFAULT_OVERLAP_SIZE,
        DEFAULT_WORD_BOUNDARY_WINDOW);
  }
}
