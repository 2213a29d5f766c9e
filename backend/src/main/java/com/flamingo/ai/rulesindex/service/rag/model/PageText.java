package com.flamingo.ai.rulesindex.service.rag.model;

/**
 * Text of a single source page as delivered by the page-text extraction collaborator.
 *
 * @param text extracted page text; may be blank
 * @param pageNumber 1-based page number; pages arrive in strictly increasing order, possibly with
 *     gaps
 */
public record PageText(String text, int pageNumber) {

  /** Returns {@code true} when the page carries no usable text. */
  public boolean isBlank() {
    return text == null || text.isBlank();
  }
}
