package com.scholary.speech.gateway.store;

/** Thrown when the backing store can't complete a read or write. */
public class StoreException extends RuntimeException {

  public StoreException(String message) {
    super(message);
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
