package com.scholary.speech.gateway.access;

/**
 * Result of model resolution.
 *
 * <p>{@code allowed=false} with a non-null {@code resolvedModel} means the requested model was
 * refused and the resolved model is the suggested alternative. {@code degraded=true} marks a
 * decision substituted because the entitlement check timed out or failed.
 */
public record AccessDecision(
    boolean allowed, String resolvedModel, String reason, boolean degraded) {

  public static AccessDecision allow(String model, String reason) {
    return new AccessDecision(true, model, reason, false);
  }

  public static AccessDecision degradedTo(String baselineModel, String reason) {
    return new AccessDecision(true, baselineModel, reason, true);
  }

  /**
   * An explicit refusal.
   *
   * @param alternative a model the caller may use instead, or null if there is none
   */
  public static AccessDecision deny(String alternative, String reason) {
    return new AccessDecision(false, alternative, reason, false);
  }

  /**
   * The model to run, which is either the authorized one or the suggested alternative.
   *
   * @throws AccessDeniedException if access was refused and there is no alternative
   */
  public String requireUsableModel() {
    if (resolvedModel == null) {
      throw new AccessDeniedException(reason);
    }
    return resolvedModel;
  }
}
