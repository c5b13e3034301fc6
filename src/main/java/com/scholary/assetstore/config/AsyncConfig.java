package com.scholary.assetstore.config;

import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for storage task execution.
 *
 * <p>Sets up a bounded thread pool for region probes, bucket checks, transfers and deletes. The
 * pool size and queue capacity are configurable to control resource usage.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "storageExecutor")
  public Executor storageExecutor(
      @Value("${objectstore.executor.threads:8}") int threads,
      @Value("${objectstore.executor.queueSize:100}") int queueSize) {

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix("object-store-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}
