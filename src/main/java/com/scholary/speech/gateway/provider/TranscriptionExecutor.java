package com.scholary.speech.gateway.provider;

import com.scholary.speech.gateway.access.AccessDecision;
import com.scholary.speech.gateway.access.ModelCatalog;
import com.scholary.speech.gateway.access.ModelInfo;
import com.scholary.speech.gateway.chunking.AudioContainer;
import com.scholary.speech.gateway.chunking.Chunk;
import com.scholary.speech.gateway.logging.StructuredLogger;
import com.scholary.speech.gateway.transcript.TranscriptFragment;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs a chunk through the provider of its resolved model.
 *
 * <p>When that provider fails, the chunk is retried exactly once on the equivalent-tier model
 * configured in {@code providers.fallback-models}, with the same language. If the fallback fails
 * too, or no fallback is configured, the chunk fails with {@link TranscriptionFailedException}.
 */
@Service
public class TranscriptionExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionExecutor.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final Map<String, SpeechProvider> providers;
  private final ModelCatalog catalog;
  private final ProviderProperties properties;
  private final TranscriptCleaner cleaner;

  public TranscriptionExecutor(
      List<SpeechProvider> providers,
      ModelCatalog catalog,
      ProviderProperties properties,
      TranscriptCleaner cleaner) {
    this.providers =
        providers.stream().collect(Collectors.toMap(SpeechProvider::name, Function.identity()));
    this.catalog = catalog;
    this.properties = properties;
    this.cleaner = cleaner;
    LOGGER.info("Transcription executor ready: providers={}", this.providers.keySet());
  }

  /**
   * Transcribe a chunk with the model the resolver chose.
   *
   * @throws com.scholary.speech.gateway.access.AccessDeniedException if the decision carries no
   *     usable model
   * @throws com.scholary.speech.gateway.chunking.ChunkInvalidException if the chunk can't be
   *     decoded
   * @throws TranscriptionFailedException if the primary and fallback attempts both fail
   */
  public TranscriptFragment transcribe(AccessDecision decision, Chunk chunk, String language) {
    String model = decision.requireUsableModel();
    AudioContainer container = AudioContainer.requireDecodable(chunk);

    try {
      return call(model, chunk, container, language);
    } catch (ProviderException primary) {
      String fallbackModel = fallbackFor(model);
      if (fallbackModel == null) {
        STRUCTURED_LOGGER.logTranscribeFailed(
            chunk.sequenceNumber(), model, errorType(primary), primary.getMessage());
        throw new TranscriptionFailedException(
            chunk.sequenceNumber(),
            String.format(
                "Chunk %d failed on %s and no fallback is configured: %s",
                chunk.sequenceNumber(), model, primary.getMessage()),
            primary);
      }

      STRUCTURED_LOGGER.logProviderFallback(
          chunk.sequenceNumber(), model, fallbackModel, errorType(primary), primary.getMessage());
      try {
        return call(fallbackModel, chunk, container, language);
      } catch (ProviderException secondary) {
        secondary.addSuppressed(primary);
        STRUCTURED_LOGGER.logTranscribeFailed(
            chunk.sequenceNumber(), fallbackModel, errorType(secondary), secondary.getMessage());
        throw new TranscriptionFailedException(
            chunk.sequenceNumber(),
            String.format(
                "Chunk %d failed on %s and on fallback %s: %s",
                chunk.sequenceNumber(), model, fallbackModel, secondary.getMessage()),
            secondary);
      }
    }
  }

  private TranscriptFragment call(
      String model, Chunk chunk, AudioContainer container, String language) {
    ModelInfo info =
        catalog
            .find(model)
            .orElseThrow(() -> new ProviderException("none", "No provider serves " + model));
    SpeechProvider provider = providers.get(info.provider());
    if (provider == null) {
      throw new ProviderException(
          info.provider(), "Provider is not configured: " + info.provider());
    }

    long start = System.currentTimeMillis();
    String text = provider.transcribe(chunk.audio(), container, language, info.name());
    LOGGER.debug(
        "Chunk {} transcribed by {} in {}ms",
        chunk.sequenceNumber(),
        info.name(),
        System.currentTimeMillis() - start);
    return new TranscriptFragment(chunk.sequenceNumber(), cleaner.clean(text), info.name());
  }

  private String fallbackFor(String model) {
    String configured = properties.fallbackModels().get(model);
    if (configured == null) {
      return null;
    }
    String canonical = catalog.canonicalize(configured);
    return canonical.equals(model) ? null : canonical;
  }

  private static String errorType(Exception e) {
    return e.getCause() != null ? e.getCause().getClass().getSimpleName() : "ProviderError";
  }
}
