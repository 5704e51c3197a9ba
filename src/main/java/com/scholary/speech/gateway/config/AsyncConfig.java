package com.scholary.speech.gateway.config;

import com.scholary.speech.gateway.access.AccessProperties;
import com.scholary.speech.gateway.usage.UsageProperties;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configuration for background task execution.
 *
 * <p>Each concern gets its own bounded pool so a slow entitlement backend cannot starve the usage
 * ledger and a bulk reset cannot starve either of them.
 */
@Configuration
public class AsyncConfig {

  /** Runs entitlement checks that the model resolver waits on with a deadline. */
  @Bean(name = "entitlementExecutor")
  public ThreadPoolTaskExecutor entitlementExecutor(AccessProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.executorThreads());
    executor.setMaxPoolSize(properties.executorThreads());
    executor.setQueueCapacity(properties.executorQueueSize());
    executor.setThreadNamePrefix("entitlement-");
    // A saturated pool degrades the decision instead of blocking the request thread
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.initialize();
    return executor;
  }

  /** Background worker for usage ledger writes. */
  @Bean(name = "usageLedgerExecutor")
  public ThreadPoolTaskExecutor usageLedgerExecutor(UsageProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.ledger().workerThreads());
    executor.setMaxPoolSize(properties.ledger().workerThreads());
    executor.setQueueCapacity(properties.ledger().queueCapacity());
    executor.setThreadNamePrefix("usage-ledger-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    executor.initialize();
    return executor;
  }

  /** Bounded pool used by bulk resets to respect backing-store rate limits. */
  @Bean(name = "usageResetExecutor")
  public ThreadPoolTaskExecutor usageResetExecutor(UsageProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.reset().parallelism());
    executor.setMaxPoolSize(properties.reset().parallelism());
    executor.setThreadNamePrefix("usage-reset-");
    executor.initialize();
    return executor;
  }

  /** Runs chunk transcriptions handed off by live recordings. */
  @Bean(name = "transcriptionExecutor")
  public Executor transcriptionExecutor(TranscriptionProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.asyncExecutorThreads());
    executor.setMaxPoolSize(properties.asyncExecutorThreads());
    executor.setQueueCapacity(properties.asyncExecutorQueueSize());
    executor.setThreadNamePrefix("transcription-");
    executor.initialize();
    return executor;
  }

  /** Timer for live recording interval rotation. */
  @Bean(name = "liveSegmentScheduler")
  public ThreadPoolTaskScheduler liveSegmentScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(2);
    scheduler.setThreadNamePrefix("live-segment-");
    scheduler.initialize();
    return scheduler;
  }
}
