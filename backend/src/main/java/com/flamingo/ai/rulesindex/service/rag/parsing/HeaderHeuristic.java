package com.flamingo.ai.rulesindex.service.rag.parsing;

import java.util.OptionalInt;

/**
 * One rule of the header decision table used by {@link SectionExtractor}.
 *
 * <p>Implementations are Spring beans; {@link SectionExtractor} receives them sorted by their
 * {@code Order} annotation and asks each in turn, so the first heuristic that matches decides the
 * level. Adding a heuristic means registering another bean, with no change to the extraction walk.
 */
public interface HeaderHeuristic {

  /**
   * Classifies a candidate line.
   *
   * @param candidate trimmed line within the configured length bounds
   * @return the heading level if the line looks like a header, empty otherwise
   */
  OptionalInt classify(HeaderCandidate candidate);

  /** Short name used in log output. */
  default String getName() {
    return getClass().getSimpleName();
  }
}
