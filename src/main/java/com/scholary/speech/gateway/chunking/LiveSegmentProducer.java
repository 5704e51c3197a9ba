package com.scholary.speech.gateway.chunking;

import com.scholary.speech.gateway.logging.StructuredLogger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

/**
 * Cuts a live recording into self-contained chunks on a fixed wall-clock interval.
 *
 * <p>At each boundary the encoder is stopped, which yields one complete recording, and a fresh
 * recording is started immediately. There is never more than one active recording per session:
 * the rotation task and {@link #stop()} both hold the session lock. Stopping cancels the timer
 * and flushes whatever was recorded since the last boundary as a final, possibly shorter, chunk.
 *
 * <p>The producer never duplicates bytes between chunks. Overlap handling happens on the text.
 */
public class LiveSegmentProducer {

  private static final Logger LOGGER = LoggerFactory.getLogger(LiveSegmentProducer.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private enum State {
    NEW,
    RECORDING,
    STOPPED
  }

  private final String sessionId;
  private final AudioEncoder encoder;
  private final TaskScheduler scheduler;
  private final Clock clock;
  private final Duration interval;
  private final ChunkListener listener;
  private final ReentrantLock lock = new ReentrantLock();

  private State state = State.NEW;
  private ScheduledFuture<?> timer;
  private Instant segmentStart;
  private int nextSequence;

  public LiveSegmentProducer(
      String sessionId,
      AudioEncoder encoder,
      TaskScheduler scheduler,
      Clock clock,
      Duration interval,
      ChunkListener listener) {
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("Interval must be positive: " + interval);
    }
    this.sessionId = sessionId;
    this.encoder = encoder;
    this.scheduler = scheduler;
    this.clock = clock;
    this.interval = interval;
    this.listener = listener;
  }

  /**
   * Start recording and schedule interval rotation.
   *
   * @throws IllegalStateException if the producer was already started
   * @throws AudioCaptureException if the encoder can't start
   */
  public void start() {
    lock.lock();
    try {
      if (state != State.NEW) {
        throw new IllegalStateException("Live session " + sessionId + " was already started");
      }
      encoder.start();
      segmentStart = clock.instant();
      state = State.RECORDING;
      timer = scheduler.scheduleAtFixedRate(this::rotate, clock.instant().plus(interval), interval);
      LOGGER.info("Live recording started: session={}, interval={}", sessionId, interval);
    } finally {
      lock.unlock();
    }
  }

  /** Close the current segment and start the next one. Runs on the scheduler at each boundary. */
  void rotate() {
    lock.lock();
    try {
      if (state != State.RECORDING) {
        return;
      }
      byte[] audio = encoder.stop();
      Instant boundary = clock.instant();
      Duration recorded = Duration.between(segmentStart, boundary);
      segmentStart = boundary;
      try {
        encoder.start();
      } catch (RuntimeException e) {
        LOGGER.error("Could not restart encoder, ending live session {}", sessionId, e);
        finish();
        emit(audio, recorded);
        listener.onComplete();
        return;
      }
      emit(audio, recorded);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stop recording and flush the final chunk. Chunks already handed to the listener are not
   * affected. Calling stop more than once has no further effect.
   */
  public void stop() {
    lock.lock();
    try {
      if (state == State.STOPPED) {
        return;
      }
      if (state == State.NEW) {
        state = State.STOPPED;
        listener.onComplete();
        return;
      }
      finish();
      byte[] audio = encoder.stop();
      emit(audio, Duration.between(segmentStart, clock.instant()));
      listener.onComplete();
      LOGGER.info("Live recording stopped: session={}, chunks={}", sessionId, nextSequence);
    } finally {
      lock.unlock();
    }
  }

  public boolean isRecording() {
    lock.lock();
    try {
      return state == State.RECORDING;
    } finally {
      lock.unlock();
    }
  }

  public String getSessionId() {
    return sessionId;
  }

  public Duration getInterval() {
    return interval;
  }

  private void finish() {
    state = State.STOPPED;
    if (timer != null) {
      timer.cancel(false);
    }
  }

  private void emit(byte[] audio, Duration recorded) {
    Optional<String> problem = AudioContainer.problem(audio);
    if (problem.isPresent()) {
      STRUCTURED_LOGGER.logChunkInvalid(
          sessionId, nextSequence, audio == null ? 0 : audio.length, problem.get());
      return;
    }

    Chunk chunk = new Chunk(nextSequence++, audio, recorded, sessionId);
    STRUCTURED_LOGGER.logChunkEmitted(
        sessionId, chunk.sequenceNumber(), chunk.size(), recorded.toMillis());
    try {
      listener.onChunk(chunk);
    } catch (RuntimeException e) {
      LOGGER.error(
          "Chunk listener failed: session={}, chunk={}", sessionId, chunk.sequenceNumber(), e);
    }
  }
}
