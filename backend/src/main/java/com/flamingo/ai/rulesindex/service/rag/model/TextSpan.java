package com.flamingo.ai.rulesindex.service.rag.model;

import java.util.List;

/**
 * One logical span handed to the segmenter: a whole section body or a whole page.
 *
 * @param sourceId source document the span belongs to
 * @param text span text
 * @param pageNumber page every chunk of this span is attributed to
 * @param sectionPath path of the owning section; empty for page-based chunking
 * @param sectionId id of the owning section; {@code null} for page-based chunking
 */
public record TextSpan(
    String sourceId, String text, int pageNumber, List<String> sectionPath, String sectionId) {

  public TextSpan {
    sectionPath = sectionPath == null ? List.of() : List.copyOf(sectionPath);
  }

  public static TextSpan ofPage(String sourceId, PageText page) {
    return new TextSpan(sourceId, page.text(), page.pageNumber(), List.of(), null);
  }

  public static TextSpan ofSection(RulesSection section) {
    return new TextSpan(
        section.sourceId(),
        section.text(),
        section.pageStart(),
        section.sectionPath(),
        section.id());
  }
}
