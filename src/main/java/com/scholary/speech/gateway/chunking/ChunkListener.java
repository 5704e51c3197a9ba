package com.scholary.speech.gateway.chunking;

/**
 * Receives chunks from a live producer, in sequence order.
 *
 * <p>Called while the producer holds its session lock, so implementations should hand the chunk
 * off (e.g. to an executor) rather than transcribe inline.
 */
@FunctionalInterface
public interface ChunkListener {

  void onChunk(Chunk chunk);

  /** Called once after the final chunk of a stopped session. */
  default void onComplete() {}
}
