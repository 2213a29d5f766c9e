package com.flamingo.ai.rulesindex.service.rag.parsing;

import java.util.OptionalInt;
import java.util.regex.Pattern;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Treats a capitalised line that is not a sentence and stands alone above a blank line, such as
 * {@code Shooting Attacks}, as a level-2 header.
 */
@Component
@Order(3)
public class TitleCaseHeaderHeuristic implements HeaderHeuristic {

  static final int LEVEL = 2;

  private static final Pattern TITLE_START = Pattern.compile("^[A-Z][a-z]");

  @Override
  public OptionalInt classify(HeaderCandidate candidate) {
    String text = candidate.text();
    if (TITLE_START.matcher(text).find()
        && !text.endsWith(".")
        && candidate.isFollowedByBlankLine()) {
      return OptionalInt.of(LEVEL);
    }
    return OptionalInt.empty();
  }
}
