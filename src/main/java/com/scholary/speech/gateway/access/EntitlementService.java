package com.scholary.speech.gateway.access;

/**
 * Account collaborator that knows which models and how much usage a user is entitled to.
 *
 * <p>Calls may be slow or fail. {@link ModelResolver} never calls these on a request thread
 * without a deadline.
 */
public interface EntitlementService {

  /**
   * Check whether the user's plan includes a canonical model for a service.
   *
   * @return an allow or deny decision; never degraded
   */
  AccessDecision checkModelAccess(String userId, String model, ServiceType serviceType);

  /** Check whether {@code amount} more units fit in the user's current-period allowance. */
  UsageDecision checkUsageAllowed(String userId, ServiceType serviceType, double amount);
}
