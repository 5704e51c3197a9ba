package com.scholary.speech.gateway.usage;

import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/** Month arithmetic for usage periods. All boundaries are in UTC. */
public final class ResetPeriods {

  private static final DateTimeFormatter PERIOD_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");

  private ResetPeriods() {}

  /** First instant of the month after the one containing {@code now}. */
  public static Instant nextResetDate(Instant now) {
    return YearMonth.from(now.atZone(ZoneOffset.UTC))
        .plusMonths(1)
        .atDay(1)
        .atStartOfDay(ZoneOffset.UTC)
        .toInstant();
  }

  /** The {@code YYYY-MM} label of the month containing {@code instant}. */
  public static String periodLabel(Instant instant) {
    return YearMonth.from(instant.atZone(ZoneOffset.UTC)).format(PERIOD_FORMAT);
  }
}
