package com.scholary.speech.gateway.access;

import java.util.Locale;

/**
 * Subscription plans with their monthly limits.
 *
 * <p>Plans are ordered: a plan may use every model whose tier is at or below its own.
 */
public enum PlanType {
  FREE(new PlanLimits(10, 1_000, 0, 0)),
  BASIC(new PlanLimits(280, 50_000, 60, 50)),
  PROFESSIONAL(new PlanLimits(800, 160_000, 200, 150));

  private final PlanLimits limits;

  PlanType(PlanLimits limits) {
    this.limits = limits;
  }

  public PlanLimits limits() {
    return limits;
  }

  public boolean includes(PlanType tier) {
    return ordinal() >= tier.ordinal();
  }

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Lenient parse used for stored profiles; unknown plans become {@link #FREE}. */
  public static PlanType fromLabel(String value) {
    if (value == null) {
      return FREE;
    }
    for (PlanType plan : values()) {
      if (plan.name().equalsIgnoreCase(value.trim())) {
        return plan;
      }
    }
    return FREE;
  }
}
