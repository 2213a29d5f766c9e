package com.flamingo.ai.rulesindex.service.rag.parsing;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Treats a dotted numeric prefix followed by a capitalised word, such as {@code 2.1. Combat}, as a
 * header whose level is the number of dots in the prefix.
 */
@Component
@Order(2)
public class NumberedHeadingHeuristic implements HeaderHeuristic {

  private static final Pattern NUMBERED_PREFIX = Pattern.compile("^((?:\\d+\\.)+)\\s+[A-Z]");

  @Override
  public OptionalInt classify(HeaderCandidate candidate) {
    Matcher matcher = NUMBERED_PREFIX.matcher(candidate.text());
    if (!matcher.find()) {
      return OptionalInt.empty();
    }
    String prefix = matcher.group(1);
    return OptionalInt.of((int) prefix.chars().filter(c -> c == '.').count());
  }
}
