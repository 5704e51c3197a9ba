package com.scholary.speech.gateway.usage;

import com.scholary.speech.gateway.access.PlanType;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Service;

/** Read-only usage queries. */
@Service
public class UsageStatisticsService {

  private final UsageRepository repository;
  private final Clock clock;

  public UsageStatisticsService(UsageRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  public UsageStatistics statistics() {
    Instant now = clock.instant();
    Map<PlanType, Long> planDistribution = new EnumMap<>(PlanType.class);
    for (PlanType plan : PlanType.values()) {
      planDistribution.put(plan, 0L);
    }

    int totalUsers = 0;
    int needingReset = 0;
    UsageTotals totals = UsageTotals.ZERO;
    Instant nextResetDate = null;

    for (String userId : repository.userIds()) {
      Optional<UsageAccount> found = repository.findAccount(userId);
      if (found.isEmpty()) {
        continue;
      }
      UsageAccount account = found.get();
      UsagePeriod period = account.currentPeriod();
      totalUsers++;
      totals = totals.plus(period);
      planDistribution.merge(account.effectivePlan(), 1L, Long::sum);
      if (period.isDue(now)) {
        needingReset++;
      } else if (nextResetDate == null || period.resetDate().isBefore(nextResetDate)) {
        nextResetDate = period.resetDate();
      }
    }

    return new UsageStatistics(
        totalUsers, totals, needingReset, planDistribution, nextResetDate, now);
  }

  public Optional<UsageAccount> usage(String userId) {
    return repository.findAccount(userId);
  }
}
