package com.scholary.speech.gateway.usage;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.scholary.speech.gateway.access.ServiceType;
import java.time.Instant;
import java.util.Objects;

/**
 * A user's consumption in the current month.
 *
 * <p>Immutable; every change produces a new value that is written back with a compare-and-set.
 * {@code resetDate} is always the first instant of a future month in UTC.
 */
public record UsagePeriod(
    double transcriptionMinutes,
    long translationWords,
    double ttsMinutes,
    long aiCredits,
    Instant resetDate) {

  public UsagePeriod {
    Objects.requireNonNull(resetDate, "resetDate");
  }

  public static UsagePeriod empty(Instant resetDate) {
    return new UsagePeriod(0, 0, 0, 0, resetDate);
  }

  /** Counters plus {@code amount} units of one service. Minutes keep two decimals. */
  public UsagePeriod plus(ServiceType serviceType, double amount) {
    return switch (serviceType) {
      case TRANSCRIPTION -> new UsagePeriod(
          roundMinutes(transcriptionMinutes + amount),
          translationWords,
          ttsMinutes,
          aiCredits,
          resetDate);
      case TRANSLATION -> new UsagePeriod(
          transcriptionMinutes,
          translationWords + Math.round(amount),
          ttsMinutes,
          aiCredits,
          resetDate);
      case TTS -> new UsagePeriod(
          transcriptionMinutes,
          translationWords,
          roundMinutes(ttsMinutes + amount),
          aiCredits,
          resetDate);
      case INTERPRETATION -> new UsagePeriod(
          transcriptionMinutes,
          translationWords,
          ttsMinutes,
          aiCredits + Math.round(amount),
          resetDate);
    };
  }

  /** Counters of both periods summed; keeps this period's reset date. */
  public UsagePeriod plus(UsagePeriod other) {
    return new UsagePeriod(
        roundMinutes(transcriptionMinutes + other.transcriptionMinutes),
        translationWords + other.translationWords,
        roundMinutes(ttsMinutes + other.ttsMinutes),
        aiCredits + other.aiCredits,
        resetDate);
  }

  public double amountFor(ServiceType serviceType) {
    return switch (serviceType) {
      case TRANSCRIPTION -> transcriptionMinutes;
      case TRANSLATION -> translationWords;
      case TTS -> ttsMinutes;
      case INTERPRETATION -> aiCredits;
    };
  }

  /** True once the reset date has been reached. */
  public boolean isDue(Instant now) {
    return !resetDate.isAfter(now);
  }

  @JsonIgnore
  public boolean isEmpty() {
    return transcriptionMinutes == 0 && translationWords == 0 && ttsMinutes == 0 && aiCredits == 0;
  }

  private static double roundMinutes(double minutes) {
    return Math.round(minutes * 100) / 100.0;
  }
}
