package com.flamingo.ai.rulesindex.service.rag;

import com.flamingo.ai.rulesindex.config.IndexingConfig;
import com.flamingo.ai.rulesindex.exception.DocumentIndexingException;
import com.flamingo.ai.rulesindex.service.rag.chunking.ChunkAssembler;
import com.flamingo.ai.rulesindex.service.rag.cleaning.PageTextCleaner;
import com.flamingo.ai.rulesindex.service.rag.model.IndexingResult;
import com.flamingo.ai.rulesindex.service.rag.model.PageText;
import com.flamingo.ai.rulesindex.service.rag.model.RulesChunk;
import com.flamingo.ai.rulesindex.service.rag.model.RulesDataset;
import com.flamingo.ai.rulesindex.service.rag.model.RulesSection;
import com.flamingo.ai.rulesindex.service.rag.model.RulesTable;
import com.flamingo.ai.rulesindex.service.rag.parsing.DatasetAssembler;
import com.flamingo.ai.rulesindex.service.rag.parsing.SectionExtractor;
import com.flamingo.ai.rulesindex.service.rag.parsing.TableExtractor;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Indexes one rules source: detect tables, clean page text, recover sections, chunk.
 *
 * <p>Tables are detected on the page text as delivered, before cleaning collapses the column gaps
 * they are recognized by.
 *
 * <p>The whole run is synchronous and touches no shared mutable state, so independent sources can
 * be indexed concurrently (see {@link BatchIndexingService}).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RulesIndexingService {

  private final PageTextCleaner pageTextCleaner;
  private final SectionExtractor sectionExtractor;
  private final ChunkAssembler chunkAssembler;
  private final TableExtractor tableExtractor;
  private final DatasetAssembler datasetAssembler;
  private final IndexingConfig indexingConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Produces the sections, chunks, tables and datasets of a source.
   *
   * @param sourceId id stamped on every produced record
   * @param pages page texts in strictly increasing page order; {@code null} or empty yields an
   *     empty result
   * @return the indexed records, with chunk order indexes running from 0
   * @throws DocumentIndexingException if the source id is blank or the pages are malformed
   */
  @Timed(value = "rules.index", description = "Time to index one rules source")
  public IndexingResult index(String sourceId, List<PageText> pages) {
    validate(sourceId, pages);
    if (pages == null || pages.isEmpty()) {
      log.debug("Source {} has no pages; nothing to index", sourceId);
      return IndexingResult.empty(sourceId);
    }

    List<RulesTable> tables = List.of();
    List<RulesDataset> datasets = List.of();
    if (indexingConfig.getTables().isEnabled()) {
      tables = tableExtractor.extract(sourceId, pages);
      datasets = datasetAssembler.assemble(sourceId, tables);
    }

    List<PageText> prepared = pageTextCleaner.clean(pages);
    List<RulesSection> sections = sectionExtractor.extract(sourceId, prepared);
    List<RulesChunk> chunks = chunkAssembler.assemble(sourceId, prepared, sections);

    recordMetrics(sections, chunks, tables);
    log.info(
        "Source {} indexed: {} pages, {} sections, {} chunks, {} tables{}",
        sourceId,
        pages.size(),
        sections.size(),
        chunks.size(),
        tables.size(),
        sections.isEmpty() ? " (page-based)" : "");
    return new IndexingResult(sourceId, sections, chunks, tables, datasets);
  }

  private void validate(String sourceId, List<PageText> pages) {
    if (sourceId == null || sourceId.isBlank()) {
      throw new DocumentIndexingException(sourceId, "sourceId must not be blank");
    }
    if (pages == null) {
      return;
    }
    int previousPage = 0;
    for (PageText page : pages) {
      if (page == null) {
        throw new DocumentIndexingException(sourceId, "Page list contains a null entry");
      }
      if (page.pageNumber() < 1) {
        throw new DocumentIndexingException(
            sourceId,
            "Invalid page number " + page.pageNumber(),
            "Rules source has an invalid page number");
      }
      if (page.pageNumber() <= previousPage) {
        throw new DocumentIndexingException(
            sourceId,
            "Page " + page.pageNumber() + " follows page " + previousPage,
            "Rules source pages are out of order");
      }
      previousPage = page.pageNumber();
    }
  }

  private void recordMetrics(
      List<RulesSection> sections, List<RulesChunk> chunks, List<RulesTable> tables) {
    int maxSize = indexingConfig.getChunking().getMaxSize();
    long oversized = chunks.stream().filter(chunk -> chunk.text().length() > maxSize).count();

    meterRegistry.counter("rules.index.sections").increment(sections.size());
    meterRegistry.counter("rules.index.chunks").increment(chunks.size());
    if (oversized > 0) {
      meterRegistry.counter("rules.index.oversized_chunks").increment(oversized);
    }
    if (sections.isEmpty()) {
      meterRegistry.counter("rules.index.fallback").increment();
    }
    for (RulesTable table : tables) {
      String confidence = table.confidence().name().toLowerCase(Locale.ROOT);
      meterRegistry.counter("rules.index.tables", "confidence", confidence).increment();
    }
  }
}
