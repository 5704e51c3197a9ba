package com.scholary.speech.gateway.provider;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the speech providers.
 *
 * <p>{@code fallbackModels} maps a canonical model to the equivalent-tier model on the other
 * provider. A model without an entry has no fallback.
 */
@ConfigurationProperties(prefix = "providers")
@Validated
public record ProviderProperties(
    @Valid @NotNull Endpoint openai,
    @Valid @NotNull Endpoint gemini,
    Map<String, String> fallbackModels) {

  public ProviderProperties {
    fallbackModels = fallbackModels == null ? Map.of() : Map.copyOf(fallbackModels);
  }

  /**
   * Connection settings for one provider. Timeouts are in seconds; the backoff before retry
   * {@code n} is {@code 2^(n-1) * retryBackoffMillis} plus up to one {@code retryBackoffMillis}
   * of jitter.
   */
  public record Endpoint(
      @NotBlank String baseUrl,
      String apiKey,
      @Positive int connectTimeout,
      @Positive int readTimeout,
      @Positive int maxRetries,
      @PositiveOrZero long retryBackoffMillis) {}
}
