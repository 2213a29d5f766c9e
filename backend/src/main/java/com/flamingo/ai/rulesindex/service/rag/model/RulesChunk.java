package com.flamingo.ai.rulesindex.service.rag.model;

import java.util.List;

/**
 * A retrieval-sized slice of a section body or of a raw page, ready to be persisted.
 *
 * @param sourceId source document the chunk belongs to
 * @param sectionId owning section id; {@code null} for page-based chunks
 * @param text trimmed, non-empty chunk text
 * @param pageStart first page covered, inclusive
 * @param pageEnd last page covered, inclusive
 * @param sectionPath path of the owning section; empty for page-based chunks
 * @param orderIndex position within the source's chunk sequence, contiguous from 0
 * @param keywords matched domain terms, in vocabulary order, without duplicates
 * @param scoreHints structural flags detected in {@code text}
 */
public record RulesChunk(
    String sourceId,
    String sectionId,
    String text,
    int pageStart,
    int pageEnd,
    List<String> sectionPath,
    int orderIndex,
    List<String> keywords,
    ScoreHints scoreHints) {

  public RulesChunk {
    sectionPath = List.copyOf(sectionPath);
    keywords = List.copyOf(keywords);
  }
}
