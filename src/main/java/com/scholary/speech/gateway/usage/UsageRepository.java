package com.scholary.speech.gateway.usage;

import com.scholary.speech.gateway.store.DocumentStore;
import com.scholary.speech.gateway.store.DocumentStore.Precondition;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Repository;

/**
 * Usage state on top of the document store.
 *
 * <p>Layout:
 *
 * <pre>
 * users/{userId}/profile                 UserProfile
 * users/{userId}/usage/currentPeriod     UsagePeriod
 * users/{userId}/usage/lastResetAt       Instant
 * usageHistory/{YYYY-MM}/{userId}        UsageArchiveRecord
 * </pre>
 */
@Repository
public class UsageRepository {

  private final DocumentStore store;

  public UsageRepository(DocumentStore store) {
    this.store = store;
  }

  static String profilePath(String userId) {
    return "users/" + checkId(userId) + "/profile";
  }

  static String periodPath(String userId) {
    return "users/" + checkId(userId) + "/usage/currentPeriod";
  }

  static String lastResetPath(String userId) {
    return "users/" + checkId(userId) + "/usage/lastResetAt";
  }

  static String archivePath(String period, String userId) {
    return "usageHistory/" + period + "/" + checkId(userId);
  }

  public Optional<UsageAccount> findAccount(String userId) {
    Optional<UsagePeriod> period = store.get(periodPath(userId), UsagePeriod.class);
    if (period.isEmpty()) {
      return Optional.empty();
    }
    UserProfile profile =
        store.get(profilePath(userId), UserProfile.class).orElse(UserProfile.defaultFor(userId));
    Instant lastResetAt = store.get(lastResetPath(userId), Instant.class).orElse(null);
    return Optional.of(new UsageAccount(profile, period.get(), lastResetAt));
  }

  /**
   * Load an account, creating it with zero counters and the next month's reset date on first
   * sight. Concurrent creators agree on a single initial period.
   */
  public UsageAccount getOrCreate(String userId, Instant now) {
    Optional<UsageAccount> existing = findAccount(userId);
    if (existing.isPresent()) {
      return existing.get();
    }

    Map<String, Object> writes = new LinkedHashMap<>();
    writes.put(periodPath(userId), UsagePeriod.empty(ResetPeriods.nextResetDate(now)));
    List<Precondition> preconditions = new ArrayList<>();
    preconditions.add(Precondition.absent(periodPath(userId)));
    if (store.get(profilePath(userId), UserProfile.class).isEmpty()) {
      writes.put(profilePath(userId), UserProfile.defaultFor(userId));
      preconditions.add(Precondition.absent(profilePath(userId)));
    }
    store.update(writes, preconditions);

    return findAccount(userId)
        .orElseThrow(() -> new IllegalStateException("Account vanished after creation: " + userId));
  }

  public Optional<UserProfile> findProfile(String userId) {
    return store.get(profilePath(userId), UserProfile.class);
  }

  /** Create or replace the profile; used by the account collaborator and tests. */
  public void saveProfile(UserProfile profile) {
    store.set(profilePath(profile.userId()), profile);
  }

  public List<String> userIds() {
    return store.childKeys("users");
  }

  public Optional<UsageArchiveRecord> findArchive(String period, String userId) {
    return store.get(archivePath(period, userId), UsageArchiveRecord.class);
  }

  /**
   * Compare-and-set the current period.
   *
   * @return false if the stored period is no longer {@code expected}
   */
  public boolean replacePeriod(String userId, UsagePeriod expected, UsagePeriod updated) {
    return store.update(
        Map.of(periodPath(userId), updated),
        List.of(new Precondition(periodPath(userId), expected)));
  }

  /**
   * Write the archive record, the fresh period and the reset timestamp as one update.
   *
   * @param expectedPeriod the period the archive was built from
   * @param existingArchive the archive already stored for this month, or null if none
   * @return false if the period or the month's archive changed since they were read
   */
  public boolean archiveAndReset(
      String userId,
      UsagePeriod expectedPeriod,
      UsageArchiveRecord existingArchive,
      UsageArchiveRecord archive,
      UsagePeriod freshPeriod,
      Instant resetAt) {
    String archivePath = archivePath(archive.period(), userId);
    Map<String, Object> writes = new LinkedHashMap<>();
    writes.put(archivePath, archive);
    writes.put(periodPath(userId), freshPeriod);
    writes.put(lastResetPath(userId), resetAt);

    return store.update(
        writes,
        List.of(
            new Precondition(periodPath(userId), expectedPeriod),
            new Precondition(archivePath, existingArchive)));
  }

  private static String checkId(String userId) {
    if (userId == null || userId.isBlank() || userId.contains("/")) {
      throw new IllegalArgumentException("Invalid user id: " + userId);
    }
    return userId;
  }
}
