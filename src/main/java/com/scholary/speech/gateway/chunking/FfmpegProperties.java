package com.scholary.speech.gateway.chunking;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg operations.
 *
 * <p>Segments are cut with stream copy, so the configured length is a target: the muxer cuts on
 * the first packet boundary after it.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String ffmpegPath,
    @NotBlank String ffprobePath,
    @NotNull Duration segmentLength,
    @PositiveOrZero int maxRetries,
    @NotNull Duration retryDelay,
    @Positive long processTimeoutSeconds) {}
