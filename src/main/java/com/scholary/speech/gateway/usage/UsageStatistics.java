package com.scholary.speech.gateway.usage;

import com.scholary.speech.gateway.access.PlanType;
import java.time.Instant;
import java.util.Map;

/**
 * Aggregate view for the admin dashboard.
 *
 * @param nextResetDate the earliest reset date still in the future, or null if none is
 */
public record UsageStatistics(
    int totalUsers,
    UsageTotals currentPeriodUsage,
    int usersNeedingReset,
    Map<PlanType, Long> planDistribution,
    Instant nextResetDate,
    Instant generatedAt) {}
