package com.flamingo.ai.rulesindex.service.rag.annotation;

import com.flamingo.ai.rulesindex.service.rag.model.ScoreHint;
import com.flamingo.ai.rulesindex.service.rag.model.ScoreHints;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Service;

/**
 * Precomputes structural signals (roll ranges, table layout, list layout, dice notation) for a
 * chunk so the downstream relevance scorer does not have to re-scan raw text.
 *
 * <p>Detectors are independent {@link ScoreHintRule}s evaluated in any order; the analyzer holds no
 * mutable state and is safe for concurrent use.
 */
@Service
public class ScoreHintAnalyzer {

  /** Numbered rows or list items before which the more-than-N count applies. */
  static final int LINE_THRESHOLD = 3;

  /** Rules shipped with the analyzer, one per {@link ScoreHint}. */
  public static final List<ScoreHintRule> DEFAULT_RULES =
      List.of(
          ScoreHintRule.textRule(
              ScoreHint.ROLL_RANGES,
              Pattern.compile("\\b[1-6]\\s*[-\u2013]\\s*[1-6]\\b"),
              Pattern.compile("\\b(?:D6|d6|D66|d66)\\b")),
          new ScoreHintRule(
              ScoreHint.TABLE_PATTERN,
              List.of(Pattern.compile("\t")),
              List.of(Pattern.compile("\\s*\\d+\\.?\\s")),
              LINE_THRESHOLD),
          new ScoreHintRule(
              ScoreHint.LIST_PATTERN,
              List.of(),
              List.of(Pattern.compile("\\s*[-\u2022*]\\s"), Pattern.compile("\\s*\\d+[.)]\\s")),
              LINE_THRESHOLD),
          ScoreHintRule.textRule(
              ScoreHint.DICE_NOTATION, Pattern.compile("\\b\\d*[dD]\\d+(?:\\+\\d+)?\\b")));

  private final List<ScoreHintRule> rules;

  public ScoreHintAnalyzer() {
    this(DEFAULT_RULES);
  }

  public ScoreHintAnalyzer(List<ScoreHintRule> rules) {
    this.rules = List.copyOf(rules);
  }

  /**
   * Analyzes {@code text} for structural signals.
   *
   * @param text chunk text; {@code null} is treated as empty
   * @return hints with only the detected flags set
   */
  public ScoreHints analyze(String text) {
    if (text == null || text.isBlank()) {
      return ScoreHints.none();
    }
    List<String> lines = text.lines().filter(line -> !line.isBlank()).toList();
    Set<ScoreHint> detected = EnumSet.noneOf(ScoreHint.class);
    for (ScoreHintRule rule : rules) {
      if (!detected.contains(rule.hint()) && rule.matches(text, lines)) {
        detected.add(rule.hint());
      }
    }
    return ScoreHints.of(detected);
  }
}
