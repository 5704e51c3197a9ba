package com.scholary.speech.gateway.usage;

import com.scholary.speech.gateway.logging.StructuredLogger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Archives and resets monthly usage counters.
 *
 * <p>Every trigger (the external scheduler, an operator, the ledger's due-date check and the
 * optional in-process cron) goes through {@link #reset(String, boolean)}. The archive record,
 * the zeroed period and the reset timestamp are written in one conditional update whose
 * precondition is the period that was read, so a caller that loses a race writes nothing. It
 * then re-reads; if the reset date moved, another caller already did the work and this one
 * reports the user as skipped.
 */
@Service
public class ResetCoordinator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResetCoordinator.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final UsageRepository repository;
  private final UsageProperties properties;
  private final Executor executor;
  private final Clock clock;

  public ResetCoordinator(
      UsageRepository repository,
      UsageProperties properties,
      @Qualifier("usageResetExecutor") Executor executor,
      Clock clock) {
    this.repository = repository;
    this.properties = properties;
    this.executor = executor;
    this.clock = clock;
  }

  /**
   * Archive and reset one user if the reset date has passed, or unconditionally if forced.
   *
   * @return what happened; never null
   * @throws ResetFailedException if every attempt failed
   */
  public ResetOutcome reset(String userId, boolean force) {
    int maxAttempts = properties.reset().maxAttempts();
    Instant readResetDate = null;
    RuntimeException lastException = null;

    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        Instant now = clock.instant();
        Optional<UsageAccount> account = repository.findAccount(userId);
        if (account.isEmpty()) {
          return ResetOutcome.notFound(userId);
        }

        UsagePeriod period = account.get().currentPeriod();
        if (readResetDate != null && !readResetDate.equals(period.resetDate())) {
          return ResetOutcome.skipped(userId, "Reset concurrently by another caller");
        }
        if (!force && !period.isDue(now)) {
          return ResetOutcome.skipped(userId, "Not due until " + period.resetDate());
        }
        readResetDate = period.resetDate();

        String month = ResetPeriods.periodLabel(now);
        UsageArchiveRecord existing = repository.findArchive(month, userId).orElse(null);
        // A second reset in the same month folds into that month's record
        UsagePeriod snapshot = existing == null ? period : existing.snapshot().plus(period);
        UsageArchiveRecord archive =
            new UsageArchiveRecord(month, userId, snapshot, account.get().effectivePlan(), now);
        UsagePeriod fresh = UsagePeriod.empty(ResetPeriods.nextResetDate(now));

        if (repository.archiveAndReset(userId, period, existing, archive, fresh, now)) {
          STRUCTURED_LOGGER.logUsageReset(userId, month, force);
          return ResetOutcome.reset(userId, month, period);
        }
        LOGGER.debug("Reset precondition failed for user {}, re-reading", userId);

      } catch (RuntimeException e) {
        lastException = e;
        LOGGER.warn(
            "Reset attempt {}/{} failed for user {}: {}",
            attempt,
            maxAttempts,
            userId,
            e.getMessage());
      }
    }

    String message =
        lastException != null
            ? "Reset failed: " + lastException.getMessage()
            : "Reset kept losing to concurrent updates";
    STRUCTURED_LOGGER.logUsageResetFailed(userId, maxAttempts, message);
    throw new ResetFailedException(userId, message, lastException);
  }

  /**
   * Reset every known user with bounded parallelism.
   *
   * <p>Users whose reset date hasn't passed are skipped unless {@code force} is set.
   */
  public ResetReport bulkReset(boolean force) {
    List<String> userIds = repository.userIds();
    String archiveMonth = ResetPeriods.periodLabel(clock.instant());
    LOGGER.info(
        "Bulk reset started: users={}, force={}, archiveMonth={}",
        userIds.size(),
        force,
        archiveMonth);

    List<CompletableFuture<UserResult>> futures = new ArrayList<>();
    for (String userId : userIds) {
      futures.add(
          CompletableFuture.supplyAsync(() -> reset(userId, force), executor)
              .handle((outcome, error) -> new UserResult(userId, outcome, error)));
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();

    int processed = 0;
    int skipped = 0;
    List<ResetReport.UserError> errors = new ArrayList<>();
    UsageTotals totals = UsageTotals.ZERO;

    for (CompletableFuture<UserResult> future : futures) {
      UserResult result = future.join();
      if (result.error() != null) {
        errors.add(new ResetReport.UserError(result.userId(), rootMessage(result.error())));
      } else if (result.outcome().status() == ResetOutcome.Status.RESET) {
        processed++;
        totals = totals.plus(result.outcome().archived());
      } else {
        skipped++;
      }
    }

    ResetReport report =
        new ResetReport(processed, skipped, errors, archiveMonth, totals, clock.instant());
    LOGGER.info(
        "Bulk reset finished: processed={}, skipped={}, errors={}, archiveMonth={}",
        processed,
        skipped,
        errors.size(),
        archiveMonth);
    return report;
  }

  private record UserResult(String userId, ResetOutcome outcome, Throwable error) {}

  private static String rootMessage(Throwable error) {
    Throwable cause = error;
    while (cause.getCause() != null && !(cause instanceof ResetFailedException)) {
      cause = cause.getCause();
    }
    return cause.getMessage();
  }
}
