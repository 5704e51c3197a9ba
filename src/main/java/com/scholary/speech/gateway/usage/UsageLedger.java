package com.scholary.speech.gateway.usage;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.speech.gateway.access.ServiceType;
import com.scholary.speech.gateway.logging.StructuredLogger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Records consumption off the request path.
 *
 * <p>Each write is queued on a bounded background executor and the caller returns immediately.
 * A write is attempted {@code usage.ledger.max-attempts} times with exponential backoff and then
 * dropped with an error log. A full queue also drops the write. Nothing here ever fails a
 * transcription.
 *
 * <p>Before incrementing, the ledger checks the user's reset date and runs the reset first if it
 * has passed, so usage never piles up past a missed scheduled reset.
 */
@Service
public class UsageLedger {

  private static final Logger LOGGER = LoggerFactory.getLogger(UsageLedger.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private static final int MAX_CAS_ROUNDS = 16;

  private final UsageRepository repository;
  private final ResetCoordinator resetCoordinator;
  private final Executor executor;
  private final UsageProperties.Ledger properties;
  private final Clock clock;
  private final Cache<String, Boolean> accountedChunks;

  public UsageLedger(
      UsageRepository repository,
      ResetCoordinator resetCoordinator,
      @Qualifier("usageLedgerExecutor") Executor executor,
      UsageProperties properties,
      Clock clock) {
    this.repository = repository;
    this.resetCoordinator = resetCoordinator;
    this.executor = executor;
    this.properties = properties.ledger();
    this.clock = clock;
    this.accountedChunks =
        Caffeine.newBuilder()
            .maximumSize(this.properties.idempotencyMaxSize())
            .expireAfterWrite(this.properties.idempotencyTtl())
            .build();
  }

  /** Queue an increment. Returns before the write happens. */
  public void recordUsage(String userId, ServiceType serviceType, double amount) {
    if (amount <= 0) {
      LOGGER.debug("Ignoring non-positive usage: user={}, amount={}", userId, amount);
      return;
    }
    try {
      executor.execute(() -> writeWithRetry(userId, serviceType, amount));
    } catch (RejectedExecutionException e) {
      STRUCTURED_LOGGER.logUsageTrackingFailure(
          userId, serviceType.name(), amount, "ledger queue full");
    }
  }

  /**
   * Queue an increment for one chunk, at most once per (session, sequence number).
   *
   * @return false if usage for this chunk was already recorded
   */
  public boolean recordChunkUsage(
      String sessionId, int sequenceNumber, String userId, ServiceType serviceType, double amount) {
    String key = sessionId + "#" + sequenceNumber;
    if (accountedChunks.asMap().putIfAbsent(key, Boolean.TRUE) != null) {
      LOGGER.info(
          "Usage for chunk already recorded, skipping: session={}, chunk={}",
          sessionId,
          sequenceNumber);
      return false;
    }
    recordUsage(userId, serviceType, amount);
    return true;
  }

  /** Transcription minutes billed for a chunk: duration / 60, rounded up to 0.01. */
  public static double transcriptionMinutes(Duration duration) {
    double minutes = duration.toMillis() / 60_000.0;
    return Math.ceil(minutes * 100 - 1e-9) / 100.0;
  }

  private void writeWithRetry(String userId, ServiceType serviceType, double amount) {
    int maxAttempts = properties.maxAttempts();
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        apply(userId, serviceType, amount);
        return;
      } catch (RuntimeException e) {
        if (attempt == maxAttempts) {
          STRUCTURED_LOGGER.logUsageTrackingFailure(
              userId, serviceType.name(), amount, e.getMessage());
          return;
        }
        STRUCTURED_LOGGER.logUsageRetry(
            userId, serviceType.name(), attempt, maxAttempts, e.getMessage());
        if (!backoff(attempt)) {
          STRUCTURED_LOGGER.logUsageTrackingFailure(
              userId, serviceType.name(), amount, "interrupted during backoff");
          return;
        }
      }
    }
  }

  /** One attempt: reset if due, then compare-and-set the incremented period. */
  void apply(String userId, ServiceType serviceType, double amount) {
    Instant now = clock.instant();
    UsageAccount account = repository.getOrCreate(userId, now);
    if (account.currentPeriod().isDue(now)) {
      LOGGER.info("Reset date passed for user {}, resetting before recording usage", userId);
      resetCoordinator.reset(userId, false);
    }

    for (int round = 0; round < MAX_CAS_ROUNDS; round++) {
      UsagePeriod current =
          repository
              .findAccount(userId)
              .map(UsageAccount::currentPeriod)
              .orElseThrow(() -> new UsageTrackingException("No usage period for " + userId));
      if (repository.replacePeriod(userId, current, current.plus(serviceType, amount))) {
        LOGGER.debug(
            "Usage recorded: user={}, service={}, amount={}", userId, serviceType, amount);
        return;
      }
    }
    throw new UsageTrackingException("Too much contention updating usage for " + userId);
  }

  private boolean backoff(int attempt) {
    long delayMs = properties.initialBackoff().toMillis() * (1L << (attempt - 1));
    if (delayMs <= 0) {
      return true;
    }
    try {
      Thread.sleep(delayMs);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
