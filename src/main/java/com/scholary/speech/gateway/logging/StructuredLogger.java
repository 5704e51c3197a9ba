package com.scholary.speech.gateway.logging;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields into the MDC for the duration of one log call, so they appear as
 * queryable attributes next to the message. Request-scoped fields ({@code sessionId},
 * {@code userId}) are managed separately with {@link #setRequestContext} and
 * {@link #clearRequestContext}.
 */
public class StructuredLogger {

  private static final List<String> EVENT_FIELDS =
      List.of(
          "event_type",
          "session_id",
          "chunk_index",
          "model",
          "requested_model",
          "fallback_model",
          "reason",
          "bytes",
          "duration_ms",
          "service_type",
          "amount",
          "attempt",
          "max_attempts",
          "error_type",
          "period",
          "stripped_words");

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** A produced chunk was discarded because it carried no decodable audio. */
  public void logChunkInvalid(String sessionId, int chunkIndex, int bytes, String reason) {
    try {
      MDC.put("event_type", "chunk_invalid");
      MDC.put("session_id", sessionId);
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("bytes", String.valueOf(bytes));
      MDC.put("reason", reason);

      logger.warn(
          "Chunk dropped: session={}, index={}, bytes={}, reason={}",
          sessionId,
          chunkIndex,
          bytes,
          reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk emitted by a segment producer. */
  public void logChunkEmitted(String sessionId, int chunkIndex, int bytes, long durationMs) {
    try {
      MDC.put("event_type", "chunk_emitted");
      MDC.put("session_id", sessionId);
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("bytes", String.valueOf(bytes));
      MDC.put("duration_ms", String.valueOf(durationMs));

      logger.debug(
          "Chunk emitted: session={}, index={}, bytes={}, duration={}ms",
          sessionId,
          chunkIndex,
          bytes,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log the outcome of model resolution, including alias upgrades. */
  public void logModelResolved(
      String sessionId, String requestedModel, String resolvedModel, String reason) {
    try {
      MDC.put("event_type", "model_resolved");
      MDC.put("session_id", sessionId);
      MDC.put("requested_model", requestedModel);
      MDC.put("model", resolvedModel);
      MDC.put("reason", reason);

      logger.info(
          "Model resolved: session={}, requested={}, resolved={}, reason={}",
          sessionId,
          requestedModel,
          resolvedModel,
          reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log a decision that fell back to the baseline because the entitlement check didn't answer. */
  public void logAccessDegraded(
      String sessionId, String requestedModel, String baselineModel, String reason) {
    try {
      MDC.put("event_type", "access_degraded");
      MDC.put("session_id", sessionId);
      MDC.put("requested_model", requestedModel);
      MDC.put("model", baselineModel);
      MDC.put("reason", reason);

      logger.warn(
          "Access check degraded: session={}, requested={}, using={}, reason={}",
          sessionId,
          requestedModel,
          baselineModel,
          reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log an explicit entitlement refusal. */
  public void logAccessDenied(
      String sessionId, String requestedModel, String alternative, String reason) {
    try {
      MDC.put("event_type", "access_denied");
      MDC.put("session_id", sessionId);
      MDC.put("requested_model", requestedModel);
      if (alternative != null) {
        MDC.put("fallback_model", alternative);
      }
      MDC.put("reason", reason);

      logger.info(
          "Access denied: session={}, requested={}, alternative={}, reason={}",
          sessionId,
          requestedModel,
          alternative,
          reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log a provider failure that triggers the fallback hop. */
  public void logProviderFallback(
      int chunkIndex, String model, String fallbackModel, String errorType, String message) {
    try {
      MDC.put("event_type", "provider_fallback");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("model", model);
      MDC.put("fallback_model", fallbackModel);
      MDC.put("error_type", errorType);

      logger.warn(
          "Provider failed, falling back: chunk={}, model={}, fallback={}, error={}, message={}",
          chunkIndex,
          model,
          fallbackModel,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log transcription failure event. */
  public void logTranscribeFailed(int chunkIndex, String model, String errorType, String message) {
    try {
      MDC.put("event_type", "transcribe_failed");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("model", model);
      MDC.put("error_type", errorType);

      logger.error(
          "Transcribe failed: chunk={}, model={}, error={}, message={}",
          chunkIndex,
          model,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log overlap merge event. */
  public void logOverlapMerge(String sessionId, int chunkIndex, int strippedWords) {
    try {
      MDC.put("event_type", "overlap_merge");
      MDC.put("session_id", sessionId);
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("stripped_words", String.valueOf(strippedWords));

      logger.debug(
          "Overlap merge: session={}, chunk={}, strippedWords={}",
          sessionId,
          chunkIndex,
          strippedWords);
    } finally {
      clearEventFields();
    }
  }

  /** Log usage ledger write retry. */
  public void logUsageRetry(
      String userId, String serviceType, int attempt, int maxAttempts, String message) {
    try {
      MDC.put("event_type", "usage_retry");
      MDC.put("service_type", serviceType);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("max_attempts", String.valueOf(maxAttempts));

      logger.warn(
          "Usage write retry: user={}, service={}, attempt={}/{}, message={}",
          userId,
          serviceType,
          attempt,
          maxAttempts,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a usage write that was dropped. The transcription result was already delivered. */
  public void logUsageTrackingFailure(
      String userId, String serviceType, double amount, String reason) {
    try {
      MDC.put("event_type", "usage_tracking_failure");
      MDC.put("service_type", serviceType);
      MDC.put("amount", String.valueOf(amount));
      MDC.put("reason", reason);

      logger.error(
          "Usage write dropped: user={}, service={}, amount={}, reason={}",
          userId,
          serviceType,
          amount,
          reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log a completed per-user archive and reset. */
  public void logUsageReset(String userId, String period, boolean forced) {
    try {
      MDC.put("event_type", "usage_reset");
      MDC.put("period", period);
      MDC.put("reason", forced ? "forced" : "due");

      logger.info("Usage reset: user={}, archivedPeriod={}, forced={}", userId, period, forced);
    } finally {
      clearEventFields();
    }
  }

  /** Log a per-user reset that failed after all attempts. */
  public void logUsageResetFailed(String userId, int maxAttempts, String message) {
    try {
      MDC.put("event_type", "usage_reset_failed");
      MDC.put("max_attempts", String.valueOf(maxAttempts));

      logger.error(
          "Usage reset failed: user={}, attempts={}, message={}", userId, maxAttempts, message);
    } finally {
      clearEventFields();
    }
  }

  /** Set request context in MDC. */
  public static void setRequestContext(String sessionId, String userId) {
    if (sessionId != null) {
      MDC.put("sessionId", sessionId);
    }
    if (userId != null) {
      MDC.put("userId", userId);
    }
  }

  /** Clear request context from MDC. */
  public static void clearRequestContext() {
    MDC.remove("sessionId");
    MDC.remove("userId");
  }

  private void clearEventFields() {
    EVENT_FIELDS.forEach(MDC::remove);
  }
}
