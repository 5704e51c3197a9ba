package com.scholary.speech.gateway.usage;

/** A ledger write that could not be applied. Never reaches an HTTP caller. */
public class UsageTrackingException extends RuntimeException {

  public UsageTrackingException(String message) {
    super(message);
  }

  public UsageTrackingException(String message, Throwable cause) {
    super(message, cause);
  }
}
