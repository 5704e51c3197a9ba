package com.scholary.speech.gateway.access;

import java.util.Set;

/**
 * A canonical model the gateway can route to.
 *
 * @param name canonical identifier, as sent to the provider
 * @param provider provider name, matching {@code SpeechProvider.name()}
 * @param tier the lowest plan that includes the model
 * @param services what the model may be used for
 * @param displayName human-readable name for model pickers
 */
public record ModelInfo(
    String name, String provider, PlanType tier, Set<ServiceType> services, String displayName) {

  public boolean supports(ServiceType serviceType) {
    return services.contains(serviceType);
  }
}
