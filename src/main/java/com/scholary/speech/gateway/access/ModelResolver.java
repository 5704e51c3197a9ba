package com.scholary.speech.gateway.access;

import com.scholary.speech.gateway.logging.StructuredLogger;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Turns a requested model into an authorized, canonical one within a fixed time budget.
 *
 * <p>Order of checks:
 *
 * <ol>
 *   <li>Canonicalize the identifier through the alias table.
 *   <li>The baseline model is always allowed, without asking anyone.
 *   <li>Admins and super users are always allowed.
 *   <li>Unknown models are refused with the baseline as alternative.
 *   <li>Everything else asks the {@link EntitlementService}, on the entitlement executor, with a
 *       deadline.
 * </ol>
 *
 * <p>When the deadline passes or the check fails, the resolver answers with a degraded decision
 * for the baseline model. The in-flight check is cancelled with an interrupt, but the
 * entitlement backend may not honour it and the call can keep running in the background; its
 * eventual result is discarded. {@link #resolve} never throws and returns within the deadline
 * plus scheduling overhead.
 */
@Service
public class ModelResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(ModelResolver.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final ModelCatalog catalog;
  private final EntitlementService entitlementService;
  private final AsyncTaskExecutor executor;
  private final AccessProperties properties;

  public ModelResolver(
      ModelCatalog catalog,
      EntitlementService entitlementService,
      @Qualifier("entitlementExecutor") AsyncTaskExecutor executor,
      AccessProperties properties) {
    this.catalog = catalog;
    this.entitlementService = entitlementService;
    this.executor = executor;
    this.properties = properties;
  }

  /**
   * Resolve a model request.
   *
   * @return the decision; {@code resolvedModel} is null only for a refusal with no usable
   *     alternative
   */
  public AccessDecision resolve(ModelRequest request) {
    String requested = request.requestedModel();
    String canonical = catalog.canonicalize(requested);
    String baseline = catalog.baselineModel();

    if (requested != null && !requested.isBlank() && !canonical.equals(requested)) {
      STRUCTURED_LOGGER.logModelResolved(
          request.sessionId(), requested, canonical, "alias canonicalized");
    }

    if (canonical.equals(baseline)) {
      return AccessDecision.allow(baseline, "baseline model");
    }

    if (request.role().isPrivileged()) {
      return AccessDecision.allow(canonical, request.role() + " role");
    }

    if (catalog.find(canonical).isEmpty()) {
      return deny(request, canonical, "Unknown model: " + canonical);
    }

    AccessDecision decision =
        await(
            () ->
                entitlementService.checkModelAccess(
                    request.userId(), canonical, request.serviceType()),
            properties.modelCheckTimeout(),
            reason -> {
              STRUCTURED_LOGGER.logAccessDegraded(request.sessionId(), canonical, baseline, reason);
              return AccessDecision.degradedTo(baseline, "Entitlement check " + reason);
            });

    if (decision.degraded()) {
      return decision;
    }
    if (decision.allowed()) {
      return AccessDecision.allow(canonical, decision.reason());
    }
    return deny(request, canonical, decision.reason());
  }

  /**
   * Check the user's remaining allowance with the quota deadline. Privileged roles are not
   * metered. On timeout or failure the check degrades to allowed.
   */
  public UsageDecision checkUsage(
      String userId, Role role, ServiceType serviceType, double amount, String sessionId) {
    if (role.isPrivileged()) {
      return UsageDecision.allow(role + " role");
    }
    return await(
        () -> entitlementService.checkUsageAllowed(userId, serviceType, amount),
        properties.usageCheckTimeout(),
        reason -> {
          STRUCTURED_LOGGER.logAccessDegraded(sessionId, serviceType.name(), "unmetered", reason);
          return UsageDecision.degraded("Usage check " + reason);
        });
  }

  private AccessDecision deny(ModelRequest request, String canonical, String reason) {
    String alternative =
        catalog.baselineSupports(request.serviceType()) ? catalog.baselineModel() : null;
    STRUCTURED_LOGGER.logAccessDenied(request.sessionId(), canonical, alternative, reason);
    return AccessDecision.deny(alternative, reason);
  }

  private <T> T await(Callable<T> check, Duration timeout, Function<String, T> fallback) {
    Future<T> future;
    try {
      future = executor.submit(check);
    } catch (RejectedExecutionException e) {
      return fallback.apply("rejected: executor saturated");
    }

    try {
      T result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (result == null) {
        return fallback.apply("returned no decision");
      }
      return result;
    } catch (TimeoutException e) {
      future.cancel(true);
      return fallback.apply("timed out after " + timeout.toMillis() + "ms");
    } catch (ExecutionException e) {
      LOGGER.debug("Entitlement check failed", e.getCause());
      return fallback.apply("failed: " + e.getCause());
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      return fallback.apply("interrupted");
    }
  }
}
