package com.scholary.speech.gateway.access;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for model resolution and entitlement checks.
 *
 * <p>These map to the "access.*" keys in application.yml. Model aliases whose identifiers
 * contain dots must be written with bracket notation, e.g. {@code "[gemini-1.5-flash]"}.
 */
@ConfigurationProperties(prefix = "access")
@Validated
public record AccessProperties(
    @NotBlank String baselineModel,
    @NotNull Duration modelCheckTimeout,
    @NotNull Duration usageCheckTimeout,
    @Positive int executorThreads,
    @Positive int executorQueueSize,
    Map<String, String> modelAliases) {

  public AccessProperties {
    modelAliases = modelAliases == null ? Map.of() : Map.copyOf(modelAliases);
  }
}
