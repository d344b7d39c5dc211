package com.scholary.carrier.extractor.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for extraction job execution.
 *
 * <p>Sets up a bounded thread pool for running extraction jobs. The pool size caps how many jobs
 * hit the carrier data source at once, and the queue capacity caps how many may wait. Jobs beyond
 * that are rejected rather than queued without limit.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "extractionJobExecutor")
  public ThreadPoolTaskExecutor extractionJobExecutor(ExtractionProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.maxConcurrentJobs());
    executor.setMaxPoolSize(properties.maxConcurrentJobs());
    executor.setQueueCapacity(properties.jobQueueSize());
    executor.setThreadNamePrefix("extraction-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }
}
