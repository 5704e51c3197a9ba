package com.scholary.speech.gateway.access;

import com.scholary.speech.gateway.usage.UsageAccount;
import com.scholary.speech.gateway.usage.UsageRepository;
import com.scholary.speech.gateway.usage.UserProfile;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import org.springframework.stereotype.Service;

/**
 * Entitlements derived from the user's subscription plan.
 *
 * <p>A plan includes a model when the model's tier is at or below the plan and the model serves
 * the requested service type. An inactive subscription counts as the free plan. Quotas compare
 * the current period's counter plus the requested amount against the plan's monthly limit; a
 * period whose reset date has passed counts as empty, since the next write resets it.
 */
@Service
public class PlanEntitlementService implements EntitlementService {

  private final UsageRepository repository;
  private final ModelCatalog catalog;
  private final Clock clock;

  public PlanEntitlementService(UsageRepository repository, ModelCatalog catalog, Clock clock) {
    this.repository = repository;
    this.catalog = catalog;
    this.clock = clock;
  }

  @Override
  public AccessDecision checkModelAccess(String userId, String model, ServiceType serviceType) {
    PlanType plan = effectivePlan(userId);
    ModelInfo info = catalog.find(model).orElse(null);
    if (info == null) {
      return AccessDecision.deny(null, "Unknown model: " + model);
    }
    if (!info.supports(serviceType)) {
      return AccessDecision.deny(
          null,
          String.format("%s is not available for %s", info.displayName(), label(serviceType)));
    }
    if (!plan.includes(info.tier())) {
      return AccessDecision.deny(
          null,
          String.format(
              "%s requires the %s plan (current plan: %s)",
              info.displayName(), info.tier().label(), plan.label()));
    }
    return AccessDecision.allow(info.name(), plan.label() + " plan");
  }

  @Override
  public UsageDecision checkUsageAllowed(String userId, ServiceType serviceType, double amount) {
    Instant now = clock.instant();
    UsageAccount account = repository.findAccount(userId).orElse(null);
    PlanType plan = effectivePlan(userId);
    double used =
        account == null || account.currentPeriod().isDue(now)
            ? 0
            : account.currentPeriod().amountFor(serviceType);
    double limit = plan.limits().limitFor(serviceType);

    if (used + amount > limit) {
      return UsageDecision.deny(
          String.format(
              "Monthly %s limit reached: used %s of %s on the %s plan",
              label(serviceType), format(used), format(limit), plan.label()));
    }
    return UsageDecision.allow(
        String.format(
            "%s of %s %s remaining", format(limit - used), format(limit), label(serviceType)));
  }

  private PlanType effectivePlan(String userId) {
    return repository
        .findProfile(userId)
        .map(UserProfile::effectivePlan)
        .orElse(PlanType.FREE);
  }

  private static String label(ServiceType serviceType) {
    return serviceType.name().toLowerCase(Locale.ROOT);
  }

  private static String format(double value) {
    return value == Math.rint(value)
        ? String.valueOf((long) value)
        : String.format(Locale.ROOT, "%.2f", value);
  }
}
