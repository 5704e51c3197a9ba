package com.scholary.speech.gateway.api;

import jakarta.validation.constraints.NotBlank;

/**
 * Request for transcribing an audio object in storage.
 *
 * <p>Without a bucket the configured default bucket is used. When {@code save} is true the
 * transcript is stored next to the source with a {@code .txt} extension.
 */
public record ObjectTranscriptionRequest(
    String bucket, @NotBlank String key, String language, String model, Boolean save) {

  public ObjectTranscriptionRequest {
    if (language == null || language.isBlank()) {
      language = "en";
    }
    if (save == null) {
      save = false;
    }
  }
}
