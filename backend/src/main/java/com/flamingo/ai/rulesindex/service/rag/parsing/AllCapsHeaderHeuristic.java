package com.flamingo.ai.rulesindex.service.rag.parsing;

import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Pattern;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Treats a line written entirely in capitals, such as {@code INJURY TABLE}, as a level-1 header.
 */
@Component
@Order(1)
public class AllCapsHeaderHeuristic implements HeaderHeuristic {

  static final int LEVEL = 1;

  private static final Pattern HAS_UPPERCASE_LETTER = Pattern.compile("\\p{Lu}");
  private static final Pattern DIGITS_ONLY = Pattern.compile("\\d+");

  @Override
  public OptionalInt classify(HeaderCandidate candidate) {
    String text = candidate.text();
    if (text.equals(text.toUpperCase(Locale.ROOT))
        && HAS_UPPERCASE_LETTER.matcher(text).find()
        && !DIGITS_ONLY.matcher(text).matches()) {
      return OptionalInt.of(LEVEL);
    }
    return OptionalInt.empty();
  }
}
