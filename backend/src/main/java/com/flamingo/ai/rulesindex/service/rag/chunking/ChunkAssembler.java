package com.flamingo.ai.rulesindex.service.rag.chunking;

import com.flamingo.ai.rulesindex.service.rag.model.PageText;
import com.flamingo.ai.rulesindex.service.rag.model.RulesChunk;
import com.flamingo.ai.rulesindex.service.rag.model.RulesSection;
import com.flamingo.ai.rulesindex.service.rag.model.TextSpan;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Produces the full chunk list for one source document.
 *
 * <p>When sections were recovered, each section body is segmented in detection order, using the
 * section's first page as the page of all its chunks; sections without a body are skipped. With no
 * sections, every page is segmented on its own in page order, without section path or id.
 *
 * <p>Order indexes run from 0 without gaps across the whole source: each span starts where the
 * previous one stopped.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChunkAssembler {

  private final TextSegmenter textSegmenter;

  /**
   * Chunks one source document.
   *
   * @param sourceId id stamped on every chunk
   * @param pages the source's pages in ascending page order
   * @param sections sections extracted from {@code pages}; may be empty
   * @return chunks in order index order
   */
  public List<RulesChunk> assemble(
      String sourceId, List<PageText> pages, List<RulesSection> sections) {
    List<RulesChunk> result = new ArrayList<>();

    if (sections != null && !sections.isEmpty()) {
      chunkSections(sections, result);
    } else {
      chunkPages(sourceId, pages, result);
    }

    log.debug(
        "ChunkAssembler produced {} chunks for source {} from {} sections / {} pages",
        result.size(),
        sourceId,
        sections == null ? 0 : sections.size(),
        pages.size());
    return result;
  }

  private void chunkSections(List<RulesSection> sections, List<RulesChunk> result) {
    for (RulesSection section : sections) {
      if (!section.hasText()) {
        continue;
      }
      result.addAll(textSegmenter.segment(TextSpan.ofSection(section), result.size()));
    }
  }

  private void chunkPages(String sourceId, List<PageText> pages, List<RulesChunk> result) {
    for (PageText page : pages) {
      if (page.isBlank()) {
        continue;
      }
      result.addAll(textSegmenter.segment(TextSpan.ofPage(sourceId, page), result.size()));
    }
  }
}
