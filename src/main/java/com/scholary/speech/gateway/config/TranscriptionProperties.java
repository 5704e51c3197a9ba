package com.scholary.speech.gateway.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for transcription processing.
 *
 * <p>Controls live chunk cadence, the limits above which uploaded files are split, the dedup
 * window, session retention and resource allocation.
 */
@ConfigurationProperties(prefix = "transcription")
@Validated
public record TranscriptionProperties(
    @Valid @NotNull LiveProperties live,
    @Valid @NotNull LimitProperties limits,
    @Valid @NotNull MergeProperties merge,
    @Valid @NotNull SessionProperties session,
    @NotBlank String tempDir,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize) {

  public record LiveProperties(
      @NotNull Duration interval,
      @DecimalMin("0.0") @DecimalMax("0.5") double overlapFraction) {

    /** Trailing overlap the caller keeps for deduplication. */
    public Duration overlap() {
      return Duration.ofMillis((long) (interval.toMillis() * overlapFraction));
    }
  }

  public record LimitProperties(@Positive long maxFileBytes, @Positive long maxFileSeconds) {}

  /**
   * @param windowWords trailing words compared against the start of each new fragment
   * @param maxBufferedFragments fragments held behind a gap before the gap is marked missing
   */
  public record MergeProperties(@Positive int windowWords, @Positive int maxBufferedFragments) {}

  public record SessionProperties(@Positive int maxSessions, @Positive int ttlMinutes) {}
}
