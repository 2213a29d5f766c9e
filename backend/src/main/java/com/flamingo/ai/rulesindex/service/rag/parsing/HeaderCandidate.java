package com.flamingo.ai.rulesindex.service.rag.parsing;

/**
 * A line considered as a possible section header.
 *
 * @param text the line, trimmed
 * @param nextLine the following line (possibly on the next page), trimmed; {@code null} at the end
 *     of the document
 */
public record HeaderCandidate(String text, String nextLine) {

  /** Returns {@code true} if the following line is blank or there is none. */
  public boolean isFollowedByBlankLine() {
    return nextLine == null || nextLine.isEmpty();
  }
}
