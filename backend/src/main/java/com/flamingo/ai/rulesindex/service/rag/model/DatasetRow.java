package com.flamingo.ai.rulesindex.service.rag.model;

import java.util.Map;

/**
 * One row of a {@link RulesDataset}.
 *
 * @param data column name to cell value, as parsed from the table
 * @param pageNumber page of the table the row came from
 */
public record DatasetRow(Map<String, String> data, int pageNumber) {}
