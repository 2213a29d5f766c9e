package com.flamingo.ai.rulesindex.service.rag.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Set;

/**
 * Structural flags attached to a chunk.
 *
 * <p>Each flag is either {@code TRUE} or {@code null}: an absent flag means "not detected" and is
 * left out of the serialized form, so consumers treat missing and {@code false} alike.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScoreHints(
    Boolean hasRollRanges,
    Boolean hasTablePattern,
    Boolean hasListPattern,
    Boolean hasDiceNotation) {

  private static final ScoreHints NONE = new ScoreHints(null, null, null, null);

  public static ScoreHints none() {
    return NONE;
  }

  /** Builds hints with exactly the given signals set. */
  public static ScoreHints of(Set<ScoreHint> detected) {
    return new ScoreHints(
        flag(detected.contains(ScoreHint.ROLL_RANGES)),
        flag(detected.contains(ScoreHint.TABLE_PATTERN)),
        flag(detected.contains(ScoreHint.LIST_PATTERN)),
        flag(detected.contains(ScoreHint.DICE_NOTATION)));
  }

  /** Returns {@code true} if the given signal was detected. */
  public boolean has(ScoreHint hint) {
    Boolean value =
        switch (hint) {
          case ROLL_RANGES -> hasRollRanges;
          case TABLE_PATTERN -> hasTablePattern;
          case LIST_PATTERN -> hasListPattern;
          case DICE_NOTATION -> hasDiceNotation;
        };
    return Boolean.TRUE.equals(value);
  }

  @JsonIgnore
  public boolean isEmpty() {
    return hasRollRanges == null
        && hasTablePattern == null
        && hasListPattern == null
        && hasDiceNotation == null;
  }

  private static Boolean flag(boolean detected) {
    return detected ? Boolean.TRUE : null;
  }
}
