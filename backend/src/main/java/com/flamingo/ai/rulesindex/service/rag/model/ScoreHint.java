package com.flamingo.ai.rulesindex.service.rag.model;

/** Structural signals a downstream relevance scorer can weight without re-scanning chunk text. */
public enum ScoreHint {
  ROLL_RANGES,
  TABLE_PATTERN,
  LIST_PATTERN,
  DICE_NOTATION
}
