package com.scholary.speech.gateway.api;

import com.scholary.speech.gateway.access.ModelInfo;
import com.scholary.speech.gateway.access.ServiceType;
import java.util.List;
import java.util.Set;

/** A catalog entry as shown to model pickers. */
public record ModelView(
    String name,
    String displayName,
    String provider,
    String tier,
    Set<ServiceType> services,
    List<String> aliases,
    boolean baseline) {

  static ModelView of(ModelInfo info, List<String> aliases, boolean baseline) {
    return new ModelView(
        info.name(),
        info.displayName(),
        info.provider(),
        info.tier().label(),
        info.services(),
        aliases,
        baseline);
  }
}
