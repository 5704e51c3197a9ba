package com.scholary.speech.gateway.service;

/**
 * A client chunk that produced no text.
 *
 * <p>Marking the chunk missing can release fragments that were waiting behind it; that text is
 * carried here so the error response still delivers it. The cause tells why the chunk failed.
 */
public class ChunkFailedException extends RuntimeException {

  private final int chunkNumber;
  private final String releasedText;

  public ChunkFailedException(int chunkNumber, String releasedText, RuntimeException cause) {
    super(cause.getMessage(), cause);
    this.chunkNumber = chunkNumber;
    this.releasedText = releasedText;
  }

  public int getChunkNumber() {
    return chunkNumber;
  }

  /** Text of later chunks merged because this one was given up; may be empty. */
  public String getReleasedText() {
    return releasedText;
  }
}
