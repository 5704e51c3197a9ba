package com.scholary.speech.gateway.usage;

import com.scholary.speech.gateway.access.PlanType;
import com.scholary.speech.gateway.access.Role;

/** Account attributes that decide entitlements, stored at {@code users/{userId}/profile}. */
public record UserProfile(
    String userId, Role role, PlanType planType, boolean subscriptionActive) {

  public static UserProfile defaultFor(String userId) {
    return new UserProfile(userId, Role.NORMAL_USER, PlanType.FREE, false);
  }

  /** Paid plans only count while the subscription is active. */
  public PlanType effectivePlan() {
    return subscriptionActive ? planType : PlanType.FREE;
  }
}
