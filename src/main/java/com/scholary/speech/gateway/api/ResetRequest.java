package com.scholary.speech.gateway.api;

/** Body of a reset call. An absent body or flag means a regular, non-forced reset. */
public record ResetRequest(Boolean forceReset) {

  boolean force() {
    return Boolean.TRUE.equals(forceReset);
  }
}
