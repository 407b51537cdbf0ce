package com.flamingo.ai.papersearch.config;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools of the ingestion pipeline.
 *
 * <ul>
 *   <li>{@code documentProcessingExecutor} runs whole-document ingestions.
 *   <li>{@code extractionExecutor} runs PDF extraction so the caller can time it out.
 *   <li>{@code embeddingExecutor} runs embedding batches; when saturated the submitting ingestion
 *       embeds the batch itself.
 * </ul>
 */
@Configuration
@EnableAsync
public class AsyncConfig {

  @Bean(name = "documentProcessingExecutor")
  public Executor documentProcessingExecutor() {
    return executor("doc-proc-", 2, 4, 100, new ThreadPoolExecutor.AbortPolicy());
  }

  @Bean(name = "extractionExecutor")
  public ThreadPoolTaskExecutor extractionExecutor() {
    return executor("pdf-extract-", 2, 4, 50, new ThreadPoolExecutor.AbortPolicy());
  }

  @Bean(name = "embeddingExecutor")
  public ThreadPoolTaskExecutor embeddingExecutor() {
    return executor("embed-", 4, 8, 200, new ThreadPoolExecutor.CallerRunsPolicy());
  }

  private static ThreadPoolTaskExecutor executor(
      String threadNamePrefix,
      int corePoolSize,
      int maxPoolSize,
      int queueCapacity,
      RejectedExecutionHandler rejectionPolicy) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix(threadNamePrefix);
    executor.setCorePoolSize(corePoolSize);
    executor.setMaxPoolSize(maxPoolSize);
    executor.setQueueCapacity(queueCapacity);
    executor.setRejectedExecutionHandler(rejectionPolicy);
    // let running ingestions finish their status writes on shutdown
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
