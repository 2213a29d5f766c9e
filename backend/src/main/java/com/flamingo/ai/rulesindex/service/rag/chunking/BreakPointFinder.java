package com.flamingo.ai.rulesindex.service.rag.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Locates places where a span of text can be split.
 *
 * <p>Preferred split locations are <em>natural break points</em>: the offset immediately after a
 * run of one or more blank lines (a line holding only spaces or tabs counts as blank). When none
 * fits, callers fall back to a whitespace position near the desired length so words are never cut.
 */
@Component
public class BreakPointFinder {

  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n(?:[ \\t]*\\n)+");

  /**
   * Returns the offsets immediately following each paragraph break, in ascending order.
   *
   * @param text span text
   * @return break offsets; empty if the text has no blank lines
   */
  public List<Integer> findNaturalBreakPoints(String text) {
    List<Integer> breaks = new ArrayList<>();
    Matcher matcher = PARAGRAPH_BREAK.matcher(text);
    while (matcher.find()) {
      breaks.add(matcher.end());
    }
    return breaks;
  }

  /**
   * Picks the break point lying strictly between {@code lowerExclusive} and {@code upperExclusive}
   * that is closest to {@code target}. On a tie the earlier break wins.
   *
   * @param breakPoints ascending break offsets
   * @return the chosen offset, or empty if no break falls inside the window
   */
  public OptionalInt closestBreakPoint(
      List<Integer> breakPoints, int lowerExclusive, int upperExclusive, int target) {
    int best = -1;
    int bestDistance = Integer.MAX_VALUE;
    for (int breakPoint : breakPoints) {
      if (breakPoint <= lowerExclusive) {
        continue;
      }
      if (breakPoint >= upperExclusive) {
        break;
      }
      int distance = Math.abs(breakPoint - target);
      if (distance < bestDistance) {
        best = breakPoint;
        bestDistance = distance;
      }
    }
    return best < 0 ? OptionalInt.empty() : OptionalInt.of(best);
  }

  /**
   * Finds the whitespace character nearest to {@code target}, looking at most {@code window}
   * characters either way and never at or before {@code from}. On a tie the later position wins.
   *
   * @param text span text
   * @param from offset the split must lie after
   * @param target desired split offset
   * @param window maximum distance from {@code target}
   * @return offset of the whitespace character, or empty if the window holds none
   */
  public OptionalInt findWordBoundary(String text, int from, int target, int window) {
    for (int distance = 0; distance <= window; distance++) {
      int after = target + distance;
      if (after > from && after < text.length() && Character.isWhitespace(text.charAt(after))) {
        return OptionalInt.of(after);
      }
      int before = target - distance;
      if (before > from && before < text.length() && Character.isWhitespace(text.charAt(before))) {
        return OptionalInt.of(before);
      }
    }
    return OptionalInt.empty();
  }

  /**
   * Returns the offset of the last whitespace character strictly between {@code fromExclusive} and
   * {@code toExclusive}, i.e. where the run of characters ending at {@code toExclusive} begins.
   */
  public OptionalInt findRunStart(String text, int fromExclusive, int toExclusive) {
    for (int i = Math.min(toExclusive, text.length()) - 1; i > fromExclusive; i--) {
      if (Character.isWhitespace(text.charAt(i))) {
        return OptionalInt.of(i);
      }
    }
    return OptionalInt.empty();
  }

  /**
   * Returns the offset of the first whitespace character at or after {@code from}, or the text
   * length if the remainder is one unbroken run.
   */
  public int findRunEnd(String text, int from) {
    for (int i = Math.max(from, 0); i < text.length(); i++) {
      if (Character.isWhitespace(text.charAt(i))) {
        return i;
      }
    }
    return text.length();
  }
}
