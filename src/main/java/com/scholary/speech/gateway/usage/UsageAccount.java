package com.scholary.speech.gateway.usage;

import com.scholary.speech.gateway.access.PlanType;
import java.time.Instant;

/**
 * A user's profile together with the current usage period.
 *
 * @param lastResetAt when the last archive-and-reset ran, or null if it never has
 */
public record UsageAccount(UserProfile profile, UsagePeriod currentPeriod, Instant lastResetAt) {

  public String userId() {
    return profile.userId();
  }

  public PlanType effectivePlan() {
    return profile.effectivePlan();
  }
}
