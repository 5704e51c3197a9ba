package com.scholary.speech.gateway.usage;

/** A per-user reset that failed on every attempt. Nothing was written for that user. */
public class ResetFailedException extends RuntimeException {

  private final String userId;

  public ResetFailedException(String userId, String message, Throwable cause) {
    super(message, cause);
    this.userId = userId;
  }

  public String getUserId() {
    return userId;
  }
}
