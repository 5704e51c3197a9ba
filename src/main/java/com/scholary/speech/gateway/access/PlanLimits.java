package com.scholary.speech.gateway.access;

/** Monthly allowance of one plan. */
public record PlanLimits(
    double transcriptionMinutes, long translationWords, double ttsMinutes, long aiCredits) {

  public double limitFor(ServiceType serviceType) {
    return switch (serviceType) {
      case TRANSCRIPTION -> transcriptionMinutes;
      case TRANSLATION -> translationWords;
      case TTS -> ttsMinutes;
      case INTERPRETATION -> aiCredits;
    };
  }
}
