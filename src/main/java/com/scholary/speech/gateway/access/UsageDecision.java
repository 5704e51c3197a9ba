package com.scholary.speech.gateway.access;

/** Result of a quota check. */
public record UsageDecision(boolean allowed, String reason, boolean degraded) {

  public static UsageDecision allow(String reason) {
    return new UsageDecision(true, reason, false);
  }

  public static UsageDecision deny(String reason) {
    return new UsageDecision(false, reason, false);
  }

  public static UsageDecision degraded(String reason) {
    return new UsageDecision(true, reason, true);
  }
}
