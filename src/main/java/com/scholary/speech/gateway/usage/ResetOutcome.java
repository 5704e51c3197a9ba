package com.scholary.speech.gateway.usage;

/**
 * Result of one per-user reset.
 *
 * @param archiveMonth the archive period written, or null when nothing was reset
 * @param archived the counters that were archived, or null when nothing was reset
 * @param reason why the user was skipped, or null
 */
public record ResetOutcome(
    String userId, Status status, String archiveMonth, UsagePeriod archived, String reason) {

  public enum Status {
    RESET,
    SKIPPED,
    NOT_FOUND
  }

  static ResetOutcome reset(String userId, String archiveMonth, UsagePeriod archived) {
    return new ResetOutcome(userId, Status.RESET, archiveMonth, archived, null);
  }

  static ResetOutcome skipped(String userId, String reason) {
    return new ResetOutcome(userId, Status.SKIPPED, null, null, reason);
  }

  static ResetOutcome notFound(String userId) {
    return new ResetOutcome(userId, Status.NOT_FOUND, null, null, "No usage recorded");
  }
}
