package com.scholary.speech.gateway.provider;

/**
 * Both the primary provider and the fallback failed for a chunk. The session continues; the
 * caller can mark the chunk's interval as missing.
 */
public class TranscriptionFailedException extends RuntimeException {

  private final int chunkNumber;

  public TranscriptionFailedException(int chunkNumber, String message, Throwable cause) {
    super(message, cause);
    this.chunkNumber = chunkNumber;
  }

  public int getChunkNumber() {
    return chunkNumber;
  }
}
