package com.flamingo.ai.rulesindex.service.rag.model;

import java.util.List;
import java.util.Map;

/**
 * A table recognized in the text of one page.
 *
 * @param sourceId owning source
 * @param sectionId section the table was found in, or {@code null} when detected page by page
 * @param titleGuess nearby line taken as the title, or a type-specific default; {@code null} for
 *     generic tables
 * @param headerContext up to three lines preceding the table
 * @param pageNumber page the table starts on
 * @param rawText the table lines plus a little surrounding context
 * @param parsedRows one column-name to cell-value map per row, columns in source order
 * @param type detector that recognized the table
 * @param confidence how sure the detector is
 * @param keywords type keyword, title words and domain terms found in {@code rawText}
 */
public record RulesTable(
    String sourceId,
    String sectionId,
    String titleGuess,
    String headerContext,
    int pageNumber,
    String rawText,
    List<Map<String, String>> parsedRows,
    TableType type,
    Confidence confidence,
    List<String> keywords) {

  public RulesTable {
    parsedRows = List.copyOf(parsedRows);
    keywords = List.copyOf(keywords);
  }
}
