package com.flamingo.ai.rulesindex.service.rag.annotation;

import com.flamingo.ai.rulesindex.service.rag.model.ScoreHint;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Declarative detector for one {@link ScoreHint}.
 *
 * <p>A rule fires when any {@code textPatterns} entry is found anywhere in the text, or when more
 * than {@code lineThreshold} non-blank lines match one of the {@code linePatterns}.
 *
 * @param hint the signal this rule detects
 * @param textPatterns patterns searched across the whole text
 * @param linePatterns patterns matched at the start of each non-blank line
 * @param lineThreshold matching line count that must be exceeded
 */
public record ScoreHintRule(
    ScoreHint hint, List<Pattern> textPatterns, List<Pattern> linePatterns, int lineThreshold) {

  public ScoreHintRule {
    textPatterns = List.copyOf(textPatterns);
    linePatterns = List.copyOf(linePatterns);
  }

  public static ScoreHintRule textRule(ScoreHint hint, Pattern... patterns) {
    return new ScoreHintRule(hint, List.of(patterns), List.of(), 0);
  }

  /**
   * Evaluates the rule.
   *
   * @param text full span text
   * @param lines non-blank lines of {@code text}
   * @return {@code true} if the signal is present
   */
  public boolean matches(String text, List<String> lines) {
    for (Pattern pattern : textPatterns) {
      if (pattern.matcher(text).find()) {
        return true;
      }
    }
    if (linePatterns.isEmpty()) {
      return false;
    }
    int matchingLines = 0;
    for (String line : lines) {
      if (matchesAnyLinePattern(line) && ++matchingLines > lineThreshold) {
        return true;
      }
    }
    return false;
  }

  private boolean matchesAnyLinePattern(String line) {
    for (Pattern pattern : linePatterns) {
      if (pattern.matcher(line).lookingAt()) {
        return true;
      }
    }
    return false;
  }
}
