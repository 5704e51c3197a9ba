package com.scholary.speech.gateway.service;

import com.scholary.speech.gateway.access.AccessDeniedException;
import com.scholary.speech.gateway.access.Role;
import com.scholary.speech.gateway.chunking.AudioContainer;
import com.scholary.speech.gateway.chunking.Chunk;
import com.scholary.speech.gateway.chunking.ChunkInvalidException;
import com.scholary.speech.gateway.chunking.WavWriter;
import com.scholary.speech.gateway.config.TranscriptionProperties;
import com.scholary.speech.gateway.logging.StructuredLogger;
import com.scholary.speech.gateway.provider.TranscriptionFailedException;
import com.scholary.speech.gateway.service.ChunkProcessor.Caller;
import com.scholary.speech.gateway.service.ChunkProcessor.ProcessedChunk;
import com.scholary.speech.gateway.session.SessionRegistry;
import com.scholary.speech.gateway.session.TranscriptionSession;
import com.scholary.speech.gateway.transcript.SessionTranscript.MergeResult;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Handles chunks recorded and cut by the client.
 *
 * <p>Each chunk belongs to a session identified by the client. Its fragment is merged into the
 * session transcript in chunk order, and the response carries only the text that became final
 * with this chunk, already stripped of the overlap with the previous one.
 */
@Service
public class ChunkTranscriptionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkTranscriptionService.class);

  private final ChunkProcessor processor;
  private final SessionRegistry sessions;
  private final TranscriptionProperties properties;

  public ChunkTranscriptionService(
      ChunkProcessor processor, SessionRegistry sessions, TranscriptionProperties properties) {
    this.processor = processor;
    this.sessions = sessions;
    this.properties = properties;
  }

  /** One chunk as posted by a client. */
  public record ChunkSubmission(
      String sessionId,
      String userId,
      Role role,
      int chunkNumber,
      byte[] audio,
      String language,
      String model) {}

  /**
   * Result of one submission.
   *
   * @param text text released into the transcript by this submission; empty while earlier
   *     chunks are still outstanding
   * @param mergedChunks chunk numbers whose text is included in {@code text}
   */
  public record ChunkResult(
      String text,
      int chunkNumber,
      String model,
      boolean degraded,
      List<Integer> mergedChunks,
      boolean duplicate) {}

  /**
   * Transcribe one chunk and merge it into its session.
   *
   * <p>A chunk number the session has already merged, buffered or given up is answered as a
   * duplicate without transcribing or billing it again.
   *
   * @throws ChunkFailedException if the audio can't be decoded on its own, neither the requested
   *     model nor an alternative is allowed, or both providers failed; the session continues
   */
  public ChunkResult transcribe(ChunkSubmission submission) {
    StructuredLogger.setRequestContext(submission.sessionId(), submission.userId());
    try {
      TranscriptionSession session =
          sessions.getOrCreate(submission.sessionId(), submission.userId(), submission.role());
      session.setLanguage(submission.language());
      session.setRequestedModel(submission.model());

      Chunk chunk =
          new Chunk(
              submission.chunkNumber(),
              submission.audio(),
              durationOf(submission.audio()),
              submission.sessionId());

      if (session.getTranscript().isSettled(chunk.sequenceNumber())) {
        LOGGER.info(
            "Chunk {} of session {} was already handled, not transcribing it again",
            chunk.sequenceNumber(),
            submission.sessionId());
        return duplicateOf(chunk, session);
      }

      ProcessedChunk processed;
      try {
        processed =
            processor.process(
                chunk,
                new Caller(
                    submission.userId(),
                    submission.role(),
                    submission.model(),
                    submission.language()));
      } catch (ChunkInvalidException | AccessDeniedException | TranscriptionFailedException e) {
        session.recordFailure();
        MergeResult released = session.getTranscript().markMissing(chunk.sequenceNumber());
        LOGGER.warn(
            "Chunk {} of session {} produced no text: {}",
            chunk.sequenceNumber(),
            submission.sessionId(),
            e.getMessage());
        throw new ChunkFailedException(chunk.sequenceNumber(), released.appendedText(), e);
      }

      session.recordSuccess(processed.fragment().sourceModel(), processed.decision().degraded());
      MergeResult merged = session.getTranscript().offer(processed.fragment());
      return new ChunkResult(
          merged.appendedText(),
          chunk.sequenceNumber(),
          processed.fragment().sourceModel(),
          processed.decision().degraded(),
          merged.mergedSequences(),
          merged.duplicate());
    } finally {
      StructuredLogger.clearRequestContext();
    }
  }

  private static ChunkResult duplicateOf(Chunk chunk, TranscriptionSession session) {
    return new ChunkResult(
        "", chunk.sequenceNumber(), session.getLastModel(), session.isDegraded(), List.of(), true);
  }

  /**
   * Recorded length of the chunk. PCM WAV carries it in its header; for compressed containers
   * the live interval the client records with is the best estimate.
   */
  private Duration durationOf(byte[] audio) {
    if (AudioContainer.detect(audio).orElse(null) == AudioContainer.WAV) {
      Duration duration = WavWriter.duration(audio);
      if (!duration.isZero()) {
        return duration;
      }
    }
    return properties.live().interval();
  }
}
