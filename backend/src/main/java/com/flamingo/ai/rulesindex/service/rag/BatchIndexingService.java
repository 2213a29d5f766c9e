package com.flamingo.ai.rulesindex.service.rag;

import com.flamingo.ai.rulesindex.exception.DocumentIndexingException;
import com.flamingo.ai.rulesindex.service.rag.model.IndexingResult;
import com.flamingo.ai.rulesindex.service.rag.model.SourceDocument;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Indexes many rules sources in parallel on the {@code documentIndexingExecutor} pool.
 *
 * <p>Each source is one task. Order indexes are assigned inside a task, never across tasks, so the
 * output for a source is the same whether it is indexed alone or alongside others.
 */
@Service
@Slf4j
public class BatchIndexingService {

  private final RulesIndexingService rulesIndexingService;
  private final Executor executor;
  private final MeterRegistry meterRegistry;

  public BatchIndexingService(
      RulesIndexingService rulesIndexingService,
      @Qualifier("documentIndexingExecutor") Executor executor,
      MeterRegistry meterRegistry) {
    this.rulesIndexingService = rulesIndexingService;
    this.executor = executor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Schedules one source for indexing.
   *
   * @param source the source to index
   * @return future completing with the source's result
   */
  public CompletableFuture<IndexingResult> submit(SourceDocument source) {
    return CompletableFuture.supplyAsync(
        () -> rulesIndexingService.index(source.sourceId(), source.pages()), executor);
  }

  /**
   * Indexes all sources concurrently and waits for every one of them.
   *
   * @param sources sources to index
   * @return results in the same order as {@code sources}
   * @throws DocumentIndexingException for the first source, in input order, whose task failed
   */
  public List<IndexingResult> indexAll(List<SourceDocument> sources) {
    List<CompletableFuture<IndexingResult>> futures = new ArrayList<>(sources.size());
    for (SourceDocument source : sources) {
      futures.add(submit(source));
    }

    List<IndexingResult> results = new ArrayList<>(sources.size());
    for (int i = 0; i < sources.size(); i++) {
      results.add(await(sources.get(i), futures.get(i)));
    }
    log.info("Indexed {} rules sources", results.size());
    return results;
  }

  /**
   * Indexes all sources concurrently, then hands each result to {@code store} in input order.
   *
   * @param sources sources to index
   * @param store persistence collaborator
   * @return results in the same order as {@code sources}
   */
  public List<IndexingResult> indexAll(List<SourceDocument> sources, RulesIndexStore store) {
    List<IndexingResult> results = indexAll(sources);
    for (IndexingResult result : results) {
      store.save(result);
    }
    return results;
  }

  private IndexingResult await(SourceDocument source, CompletableFuture<IndexingResult> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      meterRegistry.counter("rules.index.failures").increment();
      log.error("Indexing failed for source {}: {}", source.sourceId(), cause.getMessage());
      if (cause instanceof DocumentIndexingException indexingException) {
        throw indexingException;
      }
      throw new DocumentIndexingException(
          source.sourceId(), "Indexing failed: " + cause.getMessage(), cause);
    }
  }
}
