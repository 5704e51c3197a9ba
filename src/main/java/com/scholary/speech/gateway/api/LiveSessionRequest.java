package com.scholary.speech.gateway.api;

/** Options for a server-side live recording; both fields are optional. */
public record LiveSessionRequest(String language, String model) {

  public LiveSessionRequest {
    if (language == null || language.isBlank()) {
      language = "en";
    }
  }
}
