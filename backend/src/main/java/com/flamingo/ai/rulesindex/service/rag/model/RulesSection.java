package com.flamingo.ai.rulesindex.service.rag.model;

import java.util.List;

/**
 * A structural unit recovered from rulebook page text: a detected header plus the body captured up
 * to the next header.
 *
 * <p>Sections are flat; {@code sectionPath} always holds just the title. The {@code level} reported
 * by the matching header heuristic is kept for a future hierarchy but not used for nesting.
 *
 * @param id pipeline-assigned key ({@code sourceId#ordinal}) that chunks reference as their
 *     section id; storage may assign its own id on persist
 * @param sourceId source document this section was extracted from
 * @param title header text, trimmed
 * @param level heading level reported by the header heuristic
 * @param sectionPath ancestor-to-self titles, here {@code [title]}
 * @param pageStart page of the header line
 * @param pageEnd page of the last line before the next header, inclusive
 * @param text captured body text, trimmed; {@code null} when nothing was captured
 * @param keywords section keywords; always empty at creation
 */
public record RulesSection(
    String id,
    String sourceId,
    String title,
    int level,
    List<String> sectionPath,
    int pageStart,
    int pageEnd,
    String text,
    List<String> keywords) {

  public RulesSection {
    sectionPath = List.copyOf(sectionPath);
    keywords = keywords == null ? List.of() : List.copyOf(keywords);
  }

  /** Builds the key chunks use to reference the {@code ordinal}-th section of a source. */
  public static String idFor(String sourceId, int ordinal) {
    return sourceId + "#" + ordinal;
  }

  /** Returns {@code true} if a non-blank body was captured for this section. */
  public boolean hasText() {
    return text != null && !text.isBlank();
  }
}
