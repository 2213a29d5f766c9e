package com.flamingo.ai.rulesindex.service.rag.model;

import java.util.List;

/**
 * One rules source queued for indexing.
 *
 * @param sourceId identifier stamped on every section and chunk
 * @param pages page texts in ascending page order
 */
public record SourceDocument(String sourceId, List<PageText> pages) {}
