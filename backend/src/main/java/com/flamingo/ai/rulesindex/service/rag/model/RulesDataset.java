package com.flamingo.ai.rulesindex.service.rag.model;

import java.util.List;

/**
 * Rows of related tables pooled across a whole source, e.g. every equipment price list.
 *
 * @param sourceId owning source
 * @param name display name
 * @param type what the rows describe
 * @param fields union of the column names of all rows, in first-seen order
 * @param confidence how sure the grouping is
 * @param rows pooled rows in table order
 */
public record RulesDataset(
    String sourceId,
    String name,
    DatasetType type,
    List<String> fields,
    Confidence confidence,
    List<DatasetRow> rows) {

  public RulesDataset {
    fields = List.copyOf(fields);
    rows = List.copyOf(rows);
  }
}
