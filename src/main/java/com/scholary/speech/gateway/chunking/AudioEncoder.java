package com.scholary.speech.gateway.chunking;

/**
 * A recorder that produces one complete, self-contained recording per start/stop cycle.
 *
 * <p>The live producer stops and restarts the encoder at every interval boundary instead of
 * slicing a continuous stream, because a slice of an encoded stream has no container header.
 * Implementations need not be thread-safe; callers serialize start and stop.
 */
public interface AudioEncoder {

  /**
   * Begin a new recording.
   *
   * @throws AudioCaptureException if the input device can't be opened
   * @throws IllegalStateException if a recording is already running
   */
  void start();

  /**
   * End the current recording.
   *
   * @return the complete recording, or an empty array when nothing was captured
   */
  byte[] stop();
}
