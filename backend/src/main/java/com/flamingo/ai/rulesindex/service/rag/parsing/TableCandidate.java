package com.flamingo.ai.rulesindex.service.rag.parsing;

import com.flamingo.ai.rulesindex.service.rag.model.Confidence;
import com.flamingo.ai.rulesindex.service.rag.model.TableType;
import java.util.List;
import java.util.Map;

/**
 * A table found by one {@link TableDetector}, before it is stamped with source and page.
 *
 * @param startLine index of the first table line within the page
 * @param endLine index of the last line the table claims; lines up to and including it are not
 *     offered to detectors again
 * @param rawText table lines with some context
 * @param titleGuess title taken from a nearby line, or a default
 * @param headerContext lines just above the table
 * @param type detector kind
 * @param confidence detector confidence
 * @param rows parsed rows
 */
public record TableCandidate(
    int startLine,
    int endLine,
    String rawText,
    String titleGuess,
    String headerContext,
    TableType type,
    Confidence confidence,
    List<Map<String, String>> rows) {

  public TableCandidate {
    rows = List.copyOf(rows);
  }
}
