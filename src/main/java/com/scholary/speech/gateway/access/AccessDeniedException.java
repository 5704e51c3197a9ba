package com.scholary.speech.gateway.access;

/** Thrown when access was refused and no alternative model or allowance exists. */
public class AccessDeniedException extends RuntimeException {

  public AccessDeniedException(String message) {
    super(message);
  }
}
