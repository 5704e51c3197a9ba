package com.scholary.speech.gateway.chunking;

import java.time.Duration;
import java.util.Objects;

/**
 * One independently decodable unit of audio.
 *
 * <p>Chunks are handed to the resolver and executor once and never persisted.
 *
 * @param sequenceNumber position within the session, strictly increasing
 * @param audio complete container bytes, header included
 * @param durationHint recorded or estimated length of the audio
 * @param sourceSessionId the session that produced the chunk
 */
public record Chunk(
    int sequenceNumber, byte[] audio, Duration durationHint, String sourceSessionId) {

  public Chunk {
    if (sequenceNumber < 0) {
      throw new IllegalArgumentException("sequenceNumber must be >= 0: " + sequenceNumber);
    }
    Objects.requireNonNull(audio, "audio");
    Objects.requireNonNull(durationHint, "durationHint");
    Objects.requireNonNull(sourceSessionId, "sourceSessionId");
  }

  public int size() {
    return audio.length;
  }

  @Override
  public String toString() {
    return "Chunk[session="
        + sourceSessionId
        + ", seq="
        + sequenceNumber
        + ", bytes="
        + audio.length
        + ", duration="
        + durationHint
        + "]";
  }
}
