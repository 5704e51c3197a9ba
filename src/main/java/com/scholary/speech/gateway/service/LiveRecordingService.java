package com.scholary.speech.gateway.service;

import com.scholary.speech.gateway.access.AccessDeniedException;
import com.scholary.speech.gateway.access.Role;
import com.scholary.speech.gateway.chunking.AudioEncoderFactory;
import com.scholary.speech.gateway.chunking.Chunk;
import com.scholary.speech.gateway.chunking.ChunkInvalidException;
import com.scholary.speech.gateway.chunking.ChunkListener;
import com.scholary.speech.gateway.chunking.LiveSegmentProducer;
import com.scholary.speech.gateway.config.TranscriptionProperties;
import com.scholary.speech.gateway.logging.StructuredLogger;
import com.scholary.speech.gateway.provider.TranscriptionFailedException;
import com.scholary.speech.gateway.service.ChunkProcessor.Caller;
import com.scholary.speech.gateway.service.ChunkProcessor.ProcessedChunk;
import com.scholary.speech.gateway.session.SessionRegistry;
import com.scholary.speech.gateway.session.TranscriptionSession;
import java.time.Clock;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Records from the server's capture device and transcribes as it goes.
 *
 * <p>The producer cuts a chunk at every interval boundary and hands it to the transcription
 * executor, so a slow provider never delays the next cut. Fragments merge into the session
 * transcript in chunk order regardless of which transcription finishes first.
 */
@Service
public class LiveRecordingService {

  private static final Logger LOGGER = LoggerFactory.getLogger(LiveRecordingService.class);

  private final SessionRegistry sessions;
  private final ChunkProcessor processor;
  private final AudioEncoderFactory encoderFactory;
  private final TaskScheduler scheduler;
  private final Executor executor;
  private final Clock clock;
  private final TranscriptionProperties properties;

  public LiveRecordingService(
      SessionRegistry sessions,
      ChunkProcessor processor,
      AudioEncoderFactory encoderFactory,
      @Qualifier("liveSegmentScheduler") TaskScheduler scheduler,
      @Qualifier("transcriptionExecutor") Executor executor,
      Clock clock,
      TranscriptionProperties properties) {
    this.sessions = sessions;
    this.processor = processor;
    this.encoderFactory = encoderFactory;
    this.scheduler = scheduler;
    this.executor = executor;
    this.clock = clock;
    this.properties = properties;
  }

  /** Snapshot of a session for status responses. */
  public record LiveStatus(
      String sessionId,
      boolean recording,
      int chunksTranscribed,
      int chunksFailed,
      List<Integer> missingChunks,
      String text,
      String model,
      boolean degraded) {

    static LiveStatus of(TranscriptionSession session) {
      return new LiveStatus(
          session.getSessionId(),
          session.isLive(),
          session.getChunksTranscribed(),
          session.getChunksFailed(),
          session.getTranscript().missing(),
          session.getTranscript().fullText(),
          session.getLastModel(),
          session.isDegraded());
    }
  }

  /**
   * Start a live recording.
   *
   * @throws com.scholary.speech.gateway.chunking.AudioCaptureException if no capture device can
   *     be opened
   */
  public LiveStatus start(String userId, Role role, String language, String model) {
    String sessionId = "live-" + UUID.randomUUID();
    TranscriptionSession session = sessions.getOrCreate(sessionId, userId, role);
    session.setLanguage(language);
    session.setRequestedModel(model);

    Caller caller = new Caller(userId, role, model, language);
    LiveSegmentProducer producer =
        new LiveSegmentProducer(
            sessionId,
            encoderFactory.create(),
            scheduler,
            clock,
            properties.live().interval(),
            new TranscribingListener(session, caller));
    session.attachProducer(producer);

    try {
      producer.start();
    } catch (RuntimeException e) {
      sessions.remove(sessionId);
      throw e;
    }
    LOGGER.info(
        "Live session started: session={}, user={}, interval={}, overlap={}",
        sessionId,
        userId,
        properties.live().interval(),
        properties.live().overlap());
    return LiveStatus.of(session);
  }

  /**
   * Stop recording. The final chunk is flushed; chunks already queued still complete.
   *
   * @throws NoSuchElementException if the session is unknown or not the caller's
   */
  public LiveStatus stop(String sessionId, String userId) {
    TranscriptionSession session = require(sessionId, userId);
    session.getProducer().ifPresent(LiveSegmentProducer::stop);
    return LiveStatus.of(session);
  }

  /** @throws NoSuchElementException if the session is unknown or not the caller's */
  public LiveStatus status(String sessionId, String userId) {
    return LiveStatus.of(require(sessionId, userId));
  }

  private TranscriptionSession require(String sessionId, String userId) {
    return sessions
        .find(sessionId)
        .filter(s -> s.getUserId().equals(userId))
        .orElseThrow(() -> new NoSuchElementException("Unknown session: " + sessionId));
  }

  private void transcribe(TranscriptionSession session, Caller caller, Chunk chunk) {
    StructuredLogger.setRequestContext(session.getSessionId(), caller.userId());
    try {
      ProcessedChunk processed = processor.process(chunk, caller);
      session.recordSuccess(processed.fragment().sourceModel(), processed.decision().degraded());
      session.getTranscript().offer(processed.fragment());
    } catch (ChunkInvalidException | AccessDeniedException | TranscriptionFailedException e) {
      LOGGER.warn(
          "Live chunk {} produced no text: {}", chunk.sequenceNumber(), e.getMessage());
      session.recordFailure();
      session.getTranscript().markMissing(chunk.sequenceNumber());
    } finally {
      StructuredLogger.clearRequestContext();
    }
  }

  private final class TranscribingListener implements ChunkListener {

    private final TranscriptionSession session;
    private final Caller caller;

    TranscribingListener(TranscriptionSession session, Caller caller) {
      this.session = session;
      this.caller = caller;
    }

    @Override
    public void onChunk(Chunk chunk) {
      try {
        executor.execute(() -> transcribe(session, caller, chunk));
      } catch (RejectedExecutionException e) {
        LOGGER.error(
            "Transcription queue full, dropping live chunk {} of session {}",
            chunk.sequenceNumber(),
            session.getSessionId());
        session.recordFailure();
        session.getTranscript().markMissing(chunk.sequenceNumber());
      }
    }

    @Override
    public void onComplete() {
      LOGGER.info("Live session {} produced its final chunk", session.getSessionId());
    }
  }
}
