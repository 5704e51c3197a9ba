package com.scholary.speech.gateway.usage;

import com.scholary.speech.gateway.access.PlanType;
import java.time.Instant;

/**
 * Snapshot of a closed usage period, stored at {@code usageHistory/{period}/{userId}}.
 *
 * @param period the month the reset ran in, {@code YYYY-MM} in UTC
 * @param snapshot the counters as they were just before the reset
 * @param planType the effective plan at archive time
 * @param archivedAt when the reset ran
 */
public record UsageArchiveRecord(
    String period, String userId, UsagePeriod snapshot, PlanType planType, Instant archivedAt) {}
