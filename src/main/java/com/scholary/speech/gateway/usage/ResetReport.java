package com.scholary.speech.gateway.usage;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate result of a bulk reset. A failed user is listed in {@code errors} and does not
 * affect the others.
 */
public record ResetReport(
    int usersProcessed,
    int usersSkipped,
    List<UserError> errors,
    String archiveMonth,
    UsageTotals archivedTotals,
    Instant completedAt) {

  /** A user whose reset failed after all attempts. */
  public record UserError(String userId, String error) {}
}
