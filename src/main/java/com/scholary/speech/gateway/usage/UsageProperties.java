package com.scholary.speech.gateway.usage;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for usage accounting and the monthly reset. */
@ConfigurationProperties(prefix = "usage")
@Validated
public record UsageProperties(@Valid @NotNull Ledger ledger, @Valid @NotNull Reset reset) {

  /**
   * Background ledger settings.
   *
   * @param workerThreads writer threads
   * @param queueCapacity pending writes accepted before new ones are dropped
   * @param maxAttempts attempts per write, including the first
   * @param initialBackoff delay before the second attempt, doubled on each further attempt
   * @param idempotencyTtl how long a (session, chunk) accounting key is remembered
   * @param idempotencyMaxSize upper bound on remembered keys
   */
  public record Ledger(
      @Positive int workerThreads,
      @Positive int queueCapacity,
      @Positive int maxAttempts,
      @NotNull Duration initialBackoff,
      @NotNull Duration idempotencyTtl,
      @Positive long idempotencyMaxSize) {}

  /**
   * Reset settings. The token is shared with the external scheduler; a blank token rejects every
   * token-authenticated call.
   */
  public record Reset(
      String token,
      @Positive int parallelism,
      @Positive int maxAttempts,
      boolean scheduleEnabled,
      @NotBlank String cron) {}
}
