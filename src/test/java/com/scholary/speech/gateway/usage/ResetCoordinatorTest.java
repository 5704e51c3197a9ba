package com.scholary.speech.gateway.usage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.speech.gateway.access.PlanType;
import com.scholary.speech.gateway.access.Role;
import com.scholary.speech.gateway.access.ServiceType;
import com.scholary.speech.gateway.store.InMemoryDocumentStore;
import com.scholary.speech.gateway.store.StoreException;
import com.scholary.speech.gateway.testutil.MutableClock;
import com.scholary.speech.gateway.testutil.TestProperties;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ResetCoordinatorTest {

  private static final Instant FEBRUARY = Instant.parse("2025-02-10T12:00:00Z");
  private static final Instant MARCH = Instant.parse("2025-03-01T00:05:00Z");

  private MutableClock clock;
  private FlakyStore store;
  private UsageRepository repository;
  private ExecutorService pool;
  private ResetCoordinator coordinator;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(FEBRUARY);
    store = new FlakyStore();
    repository = new UsageRepository(store);
    pool = Executors.newFixedThreadPool(4);
    coordinator =
        new ResetCoordinator(repository, TestProperties.usage("secret"), pool, clock);
  }

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  @Test
  void reset_shouldSkipUsersWhoseResetDateHasNotPassed() {
    seed("alice", 12.5);

    ResetOutcome outcome = coordinator.reset("alice", false);

    assertThat(outcome.status()).isEqualTo(ResetOutcome.Status.SKIPPED);
    assertThat(outcome.reason()).contains("2025-03-01T00:00:00Z");
    assertThat(period("alice").transcriptionMinutes()).isEqualTo(12.5);
    assertThat(repository.findArchive("2025-02", "alice")).isEmpty();
  }

  @Test
  void reset_shouldArchiveAndZeroInOneStepWhenDue() {
    seed("alice", 12.5);
    clock.set(MARCH);

    ResetOutcome outcome = coordinator.reset("alice", false);

    assertThat(outcome.status()).isEqualTo(ResetOutcome.Status.RESET);
    assertThat(outcome.archiveMonth()).isEqualTo("2025-03");
    UsageArchiveRecord archive = repository.findArchive("2025-03", "alice").orElseThrow();
    assertThat(archive.snapshot().transcriptionMinutes()).isEqualTo(12.5);
    assertThat(archive.planType()).isEqualTo(PlanType.BASIC);
    assertThat(archive.archivedAt()).isEqualTo(MARCH);

    UsageAccount account = repository.findAccount("alice").orElseThrow();
    assertThat(account.currentPeriod().isEmpty()).isTrue();
    assertThat(account.currentPeriod().resetDate())
        .isEqualTo(Instant.parse("2025-04-01T00:00:00Z"));
    assertThat(account.lastResetAt()).isEqualTo(MARCH);
  }

  @Test
  void reset_shouldBeIdempotentWithinAPeriod() {
    seed("alice", 12.5);
    clock.set(MARCH);

    coordinator.reset("alice", false);
    ResetOutcome second = coordinator.reset("alice", false);

    assertThat(second.status()).isEqualTo(ResetOutcome.Status.SKIPPED);
    assertThat(repository.findArchive("2025-03", "alice").orElseThrow().snapshot())
        .extracting(UsagePeriod::transcriptionMinutes)
        .isEqualTo(12.5);
  }

  @Test
  void forcedReset_shouldRunEarlyAndFoldRepeatsIntoTheSameMonth() {
    seed("alice", 3);

    ResetOutcome first = coordinator.reset("alice", true);
    add("alice", 2);
    ResetOutcome second = coordinator.reset("alice", true);

    assertThat(first.status()).isEqualTo(ResetOutcome.Status.RESET);
    assertThat(second.status()).isEqualTo(ResetOutcome.Status.RESET);
    assertThat(repository.findArchive("2025-02", "alice").orElseThrow().snapshot())
        .extracting(UsagePeriod::transcriptionMinutes)
        .isEqualTo(5.0);
    assertThat(period("alice").isEmpty()).isTrue();
  }

  @Test
  void reset_unknownUserShouldReportNotFound() {
    assertThat(coordinator.reset("nobody", false).status())
        .isEqualTo(ResetOutcome.Status.NOT_FOUND);
  }

  @Test
  void concurrentResets_shouldArchiveExactlyOnce() throws Exception {
    seed("alice", 12.5);
    clock.set(MARCH);
    int callers = 8;
    ExecutorService racers = Executors.newFixedThreadPool(callers);
    CountDownLatch go = new CountDownLatch(1);
    try {
      List<Future<ResetOutcome>> futures = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        futures.add(
            racers.submit(
                () -> {
                  go.await();
                  return coordinator.reset("alice", false);
                }));
      }
      go.countDown();

      int resets = 0;
      for (Future<ResetOutcome> future : futures) {
        if (future.get(5, TimeUnit.SECONDS).status() == ResetOutcome.Status.RESET) {
          resets++;
        }
      }

      assertThat(resets).isEqualTo(1);
      assertThat(repository.findArchive("2025-03", "alice").orElseThrow().snapshot())
          .extracting(UsagePeriod::transcriptionMinutes)
          .isEqualTo(12.5);
      assertThat(period("alice").isEmpty()).isTrue();
    } finally {
      racers.shutdownNow();
    }
  }

  @Test
  void reset_shouldWriteNothingWhenTheStoreFails() {
    seed("alice", 12.5);
    clock.set(MARCH);
    store.failUpdatesFor("alice");

    assertThatThrownBy(() -> coordinator.reset("alice", false))
        .isInstanceOf(ResetFailedException.class)
        .hasMessageContaining("store offline");

    assertThat(repository.findArchive("2025-03", "alice")).isEmpty();
    assertThat(period("alice").transcriptionMinutes()).isEqualTo(12.5);
    assertThat(repository.findAccount("alice").orElseThrow().lastResetAt()).isNull();
  }

  @Test
  void bulkReset_shouldCollectPerUserErrorsAndContinue() {
    seed("alice", 10);
    seed("bob", 2.5);
    seed("carol", 1);
    clock.set(MARCH);
    store.failUpdatesFor("bob");

    ResetReport report = coordinator.bulkReset(false);

    assertThat(report.usersProcessed()).isEqualTo(2);
    assertThat(report.usersSkipped()).isZero();
    assertThat(report.errors())
        .singleElement()
        .satisfies(
            error -> {
              assertThat(error.userId()).isEqualTo("bob");
              assertThat(error.error()).contains("store offline");
            });
    assertThat(report.archiveMonth()).isEqualTo("2025-03");
    assertThat(report.archivedTotals().transcriptionMinutes()).isEqualTo(11.0);
    assertThat(period("bob").transcriptionMinutes()).isEqualTo(2.5);
  }

  @Test
  void bulkReset_withoutForceShouldSkipUsersNotYetDue() {
    seed("alice", 10);
    clock.set(MARCH);
    coordinator.reset("alice", false);
    seed("bob", 4);

    ResetReport report = coordinator.bulkReset(false);

    assertThat(report.usersProcessed()).isZero();
    assertThat(report.usersSkipped()).isEqualTo(2);
    assertThat(report.errors()).isEmpty();
  }

  private void seed(String userId, double minutes) {
    repository.saveProfile(new UserProfile(userId, Role.NORMAL_USER, PlanType.BASIC, true));
    repository.getOrCreate(userId, clock.instant());
    add(userId, minutes);
  }

  private void add(String userId, double minutes) {
    UsagePeriod current = period(userId);
    assertThat(
            repository.replacePeriod(
                userId, current, current.plus(ServiceType.TRANSCRIPTION, minutes)))
        .isTrue();
  }

  private UsagePeriod period(String userId) {
    return repository.findAccount(userId).orElseThrow().currentPeriod();
  }

  /** Fails multi-path updates touching one user, as an unreachable backend would. */
  private static class FlakyStore extends InMemoryDocumentStore {

    private volatile String failingUser;

    void failUpdatesFor(String userId) {
      this.failingUser = userId;
    }

    @Override
    public boolean update(Map<String, Object> writes, List<Precondition> preconditions) {
      String user = failingUser;
      if (user != null && writes.keySet().stream().anyMatch(p -> p.startsWith("users/" + user))) {
        throw new StoreException("store offline");
      }
      return super.update(writes, preconditions);
    }
  }
}
