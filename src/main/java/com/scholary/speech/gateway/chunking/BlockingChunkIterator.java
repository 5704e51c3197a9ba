package com.scholary.speech.gateway.chunking;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Pull-style view of a live recording.
 *
 * <p>Pass it to a {@link LiveSegmentProducer} as the listener and consume the chunks from another
 * thread. {@link #hasNext()} blocks until the next chunk arrives or the producer completes; once
 * complete, chunks already queued are still returned before iteration ends. Single use.
 */
public class BlockingChunkIterator implements ChunkListener, Iterator<Chunk> {

  // Optional.empty() marks completion
  private final BlockingQueue<Optional<Chunk>> queue = new LinkedBlockingQueue<>();

  private Chunk next;
  private boolean ended;

  @Override
  public void onChunk(Chunk chunk) {
    queue.add(Optional.of(chunk));
  }

  @Override
  public void onComplete() {
    queue.add(Optional.empty());
  }

  /**
   * @throws IllegalStateException if the waiting thread is interrupted; the interrupt flag is
   *     restored
   */
  @Override
  public boolean hasNext() {
    if (next != null) {
      return true;
    }
    if (ended) {
      return false;
    }
    try {
      Optional<Chunk> item = queue.take();
      if (item.isEmpty()) {
        ended = true;
        return false;
      }
      next = item.get();
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for the next chunk", e);
    }
  }

  @Override
  public Chunk next() {
    if (!hasNext()) {
      throw new NoSuchElementException("Live recording has ended");
    }
    Chunk chunk = next;
    next = null;
    return chunk;
  }
}
