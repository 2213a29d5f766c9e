package com.flamingo.ai.rulesindex.service.rag.model;

import java.util.List;

/**
 * Everything derived from one source document, handed to the persistence collaborator.
 *
 * <p>Records omit storage-assigned fields ({@code id} as a database key, {@code created_at}).
 *
 * @param sourceId the indexed source
 * @param sections recovered sections in detection order; may be empty
 * @param chunks chunks in {@code orderIndex} order
 * @param tables tables in page order
 * @param datasets table rows pooled by subject
 */
public record IndexingResult(
    String sourceId,
    List<RulesSection> sections,
    List<RulesChunk> chunks,
    List<RulesTable> tables,
    List<RulesDataset> datasets) {

  public IndexingResult {
    sections = List.copyOf(sections);
    chunks = List.copyOf(chunks);
    tables = List.copyOf(tables);
    datasets = List.copyOf(datasets);
  }

  public static IndexingResult empty(String sourceId) {
    return new IndexingResult(sourceId, List.of(), List.of(), List.of(), List.of());
  }
}
