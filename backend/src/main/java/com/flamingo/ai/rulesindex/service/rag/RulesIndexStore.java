package com.flamingo.ai.rulesindex.service.rag;

import com.flamingo.ai.rulesindex.service.rag.model.IndexingResult;

/**
 * Persistence collaborator that takes ownership of indexed sections and chunks.
 *
 * <p>Implementations assign storage ids and timestamps. Chunks reference their section through
 * {@link com.flamingo.ai.rulesindex.service.rag.model.RulesSection#id()}, so an implementation that
 * generates its own section keys must remap {@code sectionId} on the chunks it writes.
 */
public interface RulesIndexStore {

  /**
   * Persists the sections and chunks of one source, replacing anything stored for it before.
   *
   * @param result the pipeline output for one source
   */
  void save(IndexingResult result);
}
