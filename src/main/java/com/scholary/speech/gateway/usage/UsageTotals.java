package com.scholary.speech.gateway.usage;

/** Counters summed over several periods or users. */
public record UsageTotals(
    double transcriptionMinutes, long translationWords, double ttsMinutes, long aiCredits) {

  public static final UsageTotals ZERO = new UsageTotals(0, 0, 0, 0);

  public UsageTotals plus(UsagePeriod period) {
    return new UsageTotals(
        round(transcriptionMinutes + period.transcriptionMinutes()),
        translationWords + period.translationWords(),
        round(ttsMinutes + period.ttsMinutes()),
        aiCredits + period.aiCredits());
  }

  public UsageTotals plus(UsageTotals other) {
    return new UsageTotals(
        round(transcriptionMinutes + other.transcriptionMinutes()),
        translationWords + other.translationWords(),
        round(ttsMinutes + other.ttsMinutes()),
        aiCredits + other.aiCredits());
  }

  private static double round(double minutes) {
    return Math.round(minutes * 100) / 100.0;
  }
}
