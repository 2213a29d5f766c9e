package com.flamingo.ai.rulesindex.service.rag.parsing;

import java.util.List;
import java.util.Optional;

/**
 * One table recognizer used by {@link TableExtractor}.
 *
 * <p>Detectors are Spring beans ordered by their {@code Order} annotation. For each unclaimed line
 * the extractor asks them in turn; a detector whose trigger fires gets to scan from that line, and
 * the first one returning a candidate claims the lines it covers.
 */
public interface TableDetector {

  /**
   * Cheap test deciding whether {@link #detect} is worth running from this line.
   *
   * @param line trimmed, non-empty line
   */
  boolean triggers(String line);

  /**
   * Scans for a table starting at or after {@code startIndex}.
   *
   * @param lines all lines of the page, untrimmed
   * @param startIndex index of the triggering line
   * @return the table, or empty if too few rows were found
   */
  Optional<TableCandidate> detect(List<String> lines, int startIndex);

  /** Joins {@code lines[from, to)} with newlines, clamping both bounds to the list. */
  static String joinLines(List<String> lines, int from, int to) {
    int start = Math.max(0, from);
    int end = Math.min(lines.size(), to);
    return start >= end ? "" : String.join("\n", lines.subList(start, end));
  }
}
