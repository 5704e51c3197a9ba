package com.scholary.speech.gateway.access;

/** Metered service a model is used for. */
public enum ServiceType {
  TRANSCRIPTION,
  TRANSLATION,
  TTS,
  INTERPRETATION
}
