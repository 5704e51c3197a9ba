package com.scholary.speech.gateway.service;

import com.scholary.speech.gateway.access.AccessDecision;
import com.scholary.speech.gateway.access.AccessDeniedException;
import com.scholary.speech.gateway.access.ModelRequest;
import com.scholary.speech.gateway.access.ModelResolver;
import com.scholary.speech.gateway.access.Role;
import com.scholary.speech.gateway.access.ServiceType;
import com.scholary.speech.gateway.access.UsageDecision;
import com.scholary.speech.gateway.chunking.AudioContainer;
import com.scholary.speech.gateway.chunking.Chunk;
import com.scholary.speech.gateway.provider.TranscriptionExecutor;
import com.scholary.speech.gateway.transcript.TranscriptFragment;
import com.scholary.speech.gateway.usage.UsageLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The per-chunk pipeline shared by every entry point: resolve the model, check the allowance,
 * transcribe, then account.
 *
 * <p>Usage is queued only after the fragment came back, and at most once per chunk.
 */
@Component
public class ChunkProcessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkProcessor.class);

  private final ModelResolver resolver;
  private final TranscriptionExecutor executor;
  private final UsageLedger ledger;

  public ChunkProcessor(
      ModelResolver resolver, TranscriptionExecutor executor, UsageLedger ledger) {
    this.resolver = resolver;
    this.executor = executor;
    this.ledger = ledger;
  }

  /** Who is asking for what. */
  public record Caller(String userId, Role role, String requestedModel, String language) {}

  /** A transcribed chunk together with the decision it ran under. */
  public record ProcessedChunk(TranscriptFragment fragment, AccessDecision decision) {}

  /**
   * Run one chunk through the pipeline.
   *
   * @throws com.scholary.speech.gateway.chunking.ChunkInvalidException if the audio can't be
   *     decoded on its own
   * @throws AccessDeniedException if the model or the allowance was refused with no alternative
   * @throws com.scholary.speech.gateway.provider.TranscriptionFailedException if both providers
   *     failed
   */
  public ProcessedChunk process(Chunk chunk, Caller caller) {
    AudioContainer.requireDecodable(chunk);

    AccessDecision decision =
        resolver.resolve(
            ModelRequest.transcription(
                caller.requestedModel(), caller.role(), chunk.sourceSessionId(), caller.userId()));

    double minutes = UsageLedger.transcriptionMinutes(chunk.durationHint());
    UsageDecision allowance =
        resolver.checkUsage(
            caller.userId(),
            caller.role(),
            ServiceType.TRANSCRIPTION,
            minutes,
            chunk.sourceSessionId());
    if (!allowance.allowed()) {
      throw new AccessDeniedException(allowance.reason());
    }

    TranscriptFragment fragment = executor.transcribe(decision, chunk, caller.language());
    ledger.recordChunkUsage(
        chunk.sourceSessionId(),
        chunk.sequenceNumber(),
        caller.userId(),
        ServiceType.TRANSCRIPTION,
        minutes);

    LOGGER.info(
        "Chunk {} of session {} transcribed: model={}, words={}, minutes={}",
        chunk.sequenceNumber(),
        chunk.sourceSessionId(),
        fragment.sourceModel(),
        fragment.text().isEmpty() ? 0 : fragment.text().split("\\s+").length,
        minutes);
    return new ProcessedChunk(fragment, decision);
  }
}
