package com.scholary.speech.gateway.chunking;

/** Thrown when the capture device can't be opened or read. */
public class AudioCaptureException extends RuntimeException {

  public AudioCaptureException(String message, Throwable cause) {
    super(message, cause);
  }
}
