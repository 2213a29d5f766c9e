package com.flamingo.ai.rulesindex.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for batch ingestion.
 *
 * <p>Each source document is indexed as one independent task; nothing is shared between tasks
 * except the read-only {@link IndexingConfig}.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

  @Bean(name = "documentIndexingExecutor")
  public Executor documentIndexingExecutor(IndexingConfig indexingConfig) {
    IndexingConfig.Batch batch = indexingConfig.getBatch();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(batch.getCorePoolSize());
    executor.setMaxPoolSize(batch.getMaxPoolSize());
    executor.setQueueCapacity(batch.getQueueCapacity());
    executor.setThreadNamePrefix("rules-index-");
    executor.initialize();
    return executor;
  }
}
