package com.scholary.speech.gateway.objectstore;

/** Thrown when an object storage operation fails. */
public class ObjectStoreException extends RuntimeException {

  private final boolean notFound;

  public ObjectStoreException(String message, Throwable cause) {
    this(message, cause, false);
  }

  public ObjectStoreException(String message, Throwable cause, boolean notFound) {
    super(message, cause);
    this.notFound = notFound;
  }

  /** True when the bucket or key does not exist. */
  public boolean isNotFound() {
    return notFound;
  }
}
