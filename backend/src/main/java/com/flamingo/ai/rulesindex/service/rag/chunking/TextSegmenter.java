package com.flamingo.ai.rulesindex.service.rag.chunking;

import com.flamingo.ai.rulesindex.config.IndexingConfig;
import com.flamingo.ai.rulesindex.service.rag.annotation.KeywordExtractor;
import com.flamingo.ai.rulesindex.service.rag.annotation.ScoreHintAnalyzer;
import com.flamingo.ai.rulesindex.service.rag.model.ChunkSizes;
import com.flamingo.ai.rulesindex.service.rag.model.RulesChunk;
import com.flamingo.ai.rulesindex.service.rag.model.TextSpan;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Splits one logical span (a section body or a page) into overlapping, retrieval-sized chunks.
 *
 * <p>A span no longer than the target size is emitted whole. Longer spans are walked left to right;
 * each chunk ends at, in order of preference:
 *
 * <ol>
 *   <li>the paragraph break between {@code min} and {@code max} size closest to the target size;
 *   <li>the whitespace nearest the target size, within the word-boundary window;
 *   <li>the end of the span, once the target size reaches it;
 *   <li>the end of the unbroken run of characters crossing the target size, if that keeps the chunk
 *       within the maximum size;
 *   <li>otherwise the whitespace just before that run, so the run becomes a chunk of its own. A run
 *       longer than the maximum size is the only chunk that may exceed it.
 * </ol>
 *
 * <p>The next chunk starts {@code overlap} characters before the previous end so text near a
 * boundary appears whole in at least one chunk, except after a break placed in front of an
 * oversized run, where the run starts the next chunk. If the overlap would not move the start
 * forward, the next chunk starts at the previous end instead, which guarantees termination.
 *
 * <p>Every chunk carries the span's page as both {@code pageStart} and {@code pageEnd}, the span's
 * section path and id, keywords and score hints. Stateless and safe for concurrent use.
 */
@Service
@Slf4j
public class TextSegmenter {

  private final KeywordExtractor keywordExtractor;
  private final ScoreHintAnalyzer scoreHintAnalyzer;
  private final BreakPointFinder breakPointFinder;
  private final ChunkSizes sizes;

  public TextSegmenter(
      KeywordExtractor keywordExtractor,
      ScoreHintAnalyzer scoreHintAnalyzer,
      BreakPointFinder breakPointFinder,
      IndexingConfig indexingConfig) {
    this.keywordExtractor = keywordExtractor;
    this.scoreHintAnalyzer = scoreHintAnalyzer;
    this.breakPointFinder = breakPointFinder;
    this.sizes = indexingConfig.getChunking().toChunkSizes();
  }

  /**
   * Segments a span.
   *
   * @param span the text and its provenance
   * @param startOrderIndex order index given to the first emitted chunk
   * @return chunks with consecutive order indexes starting at {@code startOrderIndex}; empty for a
   *     blank span
   */
  public List<RulesChunk> segment(TextSpan span, int startOrderIndex) {
    String text = span.text();
    List<RulesChunk> chunks = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return chunks;
    }

    if (text.length() <= sizes.targetSize()) {
      addChunk(chunks, span, text, startOrderIndex);
      return chunks;
    }

    List<Integer> breakPoints = breakPointFinder.findNaturalBreakPoints(text);
    int orderIndex = startOrderIndex;
    int currentStart = 0;

    while (currentStart < text.length()) {
      Break chosen = chooseBreakPoint(text, currentStart, breakPoints);
      int breakPoint = chosen.offset();
      if (addChunk(chunks, span, text.substring(currentStart, breakPoint), orderIndex)) {
        orderIndex++;
      }
      if (breakPoint >= text.length()) {
        break;
      }
      int nextStart = chosen.beforeLongRun() ? breakPoint : breakPoint - sizes.overlapSize();
      currentStart = nextStart > currentStart ? nextStart : breakPoint;
    }

    log.debug(
        "Segmented span of {} chars on page {} into {} chunks ({} paragraph breaks)",
        text.length(),
        span.pageNumber(),
        chunks.size(),
        breakPoints.size());
    return chunks;
  }

  private Break chooseBreakPoint(String text, int currentStart, List<Integer> breakPoints) {
    int targetEnd = currentStart + sizes.targetSize();

    OptionalInt natural =
        breakPointFinder.closestBreakPoint(
            breakPoints,
            currentStart + sizes.minSize(),
            currentStart + sizes.maxSize(),
            targetEnd);
    if (natural.isPresent()) {
      return new Break(natural.getAsInt(), false);
    }
    if (targetEnd >= text.length()) {
      return new Break(text.length(), false);
    }

    OptionalInt wordBoundary =
        breakPointFinder.findWordBoundary(
            text, currentStart, targetEnd, sizes.wordBoundaryWindow());
    if (wordBoundary.isPresent()) {
      return new Break(wordBoundary.getAsInt(), false);
    }

    int runEnd = breakPointFinder.findRunEnd(text, targetEnd);
    if (runEnd - currentStart <= sizes.maxSize()) {
      return new Break(runEnd, false);
    }
    OptionalInt runStart = breakPointFinder.findRunStart(text, currentStart, targetEnd);
    if (runStart.isPresent()) {
      return new Break(runStart.getAsInt(), true);
    }
    log.warn(
        "No break point near offset {}; emitting oversized chunk of {} chars",
        targetEnd,
        runEnd - currentStart);
    return new Break(runEnd, false);
  }

  private boolean addChunk(List<RulesChunk> chunks, TextSpan span, String rawText, int orderIndex) {
    String chunkText = rawText.trim();
    if (chunkText.isEmpty()) {
      return false;
    }
    chunks.add(
        new RulesChunk(
            span.sourceId(),
            span.sectionId(),
            chunkText,
            span.pageNumber(),
            span.pageNumber(),
            span.sectionPath(),
            orderIndex,
            keywordExtractor.extractKeywords(chunkText),
            scoreHintAnalyzer.analyze(chunkText)));
    return true;
  }

  /** A chunk end; {@code beforeLongRun} marks a break placed in front of an oversized run. */
  private record Break(int offset, boolean beforeLongRun) {}
}
