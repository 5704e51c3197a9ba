package com.scholary.speech.gateway.service;

import com.scholary.speech.gateway.chunking.Chunk;
import com.scholary.speech.gateway.chunking.OfflineSegmentProducer;
import com.scholary.speech.gateway.config.TranscriptionProperties;
import com.scholary.speech.gateway.logging.StructuredLogger;
import com.scholary.speech.gateway.objectstore.ObjectStoreClient;
import com.scholary.speech.gateway.objectstore.ObjectStoreClient.ObjectMetadata;
import com.scholary.speech.gateway.objectstore.ObjectStoreProperties;
import com.scholary.speech.gateway.provider.TranscriptionFailedException;
import com.scholary.speech.gateway.service.ChunkProcessor.Caller;
import com.scholary.speech.gateway.service.ChunkProcessor.ProcessedChunk;
import com.scholary.speech.gateway.transcript.OverlapDeduplicator;
import com.scholary.speech.gateway.transcript.SessionTranscript;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Transcribes whole recordings, uploaded or kept in object storage.
 *
 * <p>Files over the size or duration limit are split by the offline producer. Chunks run through
 * the same pipeline as live chunks, one after another, and a failed chunk is reported instead of
 * failing the file.
 */
@Service
public class FileTranscriptionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileTranscriptionService.class);

  private final OfflineSegmentProducer producer;
  private final ChunkProcessor processor;
  private final OverlapDeduplicator deduplicator;
  private final ObjectStoreClient objectStoreClient;
  private final ObjectStoreProperties objectStoreProperties;
  private final TranscriptionProperties properties;

  public FileTranscriptionService(
      OfflineSegmentProducer producer,
      ChunkProcessor processor,
      OverlapDeduplicator deduplicator,
      ObjectStoreClient objectStoreClient,
      ObjectStoreProperties objectStoreProperties,
      TranscriptionProperties properties) {
    this.producer = producer;
    this.processor = processor;
    this.deduplicator = deduplicator;
    this.objectStoreClient = objectStoreClient;
    this.objectStoreProperties = objectStoreProperties;
    this.properties = properties;
  }

  /**
   * Result of a file transcription.
   *
   * @param chunks number of chunks the file was split into, up to the last decodable one
   * @param model model that produced the last fragment, null if none succeeded
   * @param failedChunks chunks that produced no text
   * @param savedKey key of the stored transcript, or null when it was not saved
   */
  public record FileResult(
      String text,
      int chunks,
      String model,
      List<Integer> failedChunks,
      boolean degraded,
      String savedKey) {

    FileResult withSavedKey(String key) {
      return new FileResult(text, chunks, model, failedChunks, degraded, key);
    }
  }

  /**
   * Transcribe a local audio file.
   *
   * @throws com.scholary.speech.gateway.chunking.ChunkInvalidException if the file is not audio
   * @throws com.scholary.speech.gateway.access.AccessDeniedException if the model is refused
   * @throws IOException if the file can't be probed or split
   */
  public FileResult transcribeFile(Path file, Caller caller) throws IOException {
    String sessionId = "file-" + UUID.randomUUID();
    StructuredLogger.setRequestContext(sessionId, caller.userId());
    try {
      LOGGER.info("Starting file transcription: file={}", file.getFileName());
      SessionTranscript transcript =
          new SessionTranscript(sessionId, deduplicator, properties.merge().maxBufferedFragments());
      List<Integer> failed = new ArrayList<>();
      int count = 0;
      String model = null;
      boolean degraded = false;

      try (Stream<Chunk> chunks = producer.produce(file, sessionId)) {
        Iterator<Chunk> iterator = chunks.iterator();
        while (iterator.hasNext()) {
          Chunk chunk = iterator.next();
          // segments the producer dropped as undecodable leave a gap in the numbering
          for (int skipped = count; skipped < chunk.sequenceNumber(); skipped++) {
            failed.add(skipped);
            transcript.markMissing(skipped);
          }
          count = chunk.sequenceNumber() + 1;
          try {
            ProcessedChunk processed = processor.process(chunk, caller);
            transcript.offer(processed.fragment());
            model = processed.fragment().sourceModel();
            degraded |= processed.decision().degraded();
          } catch (TranscriptionFailedException e) {
            LOGGER.warn("Chunk {} failed, continuing: {}", chunk.sequenceNumber(), e.getMessage());
            failed.add(chunk.sequenceNumber());
            transcript.markMissing(chunk.sequenceNumber());
          }
        }
      }

      LOGGER.info(
          "File transcription complete: chunks={}, failed={}, model={}", count, failed, model);
      return new FileResult(transcript.fullText(), count, model, failed, degraded, null);
    } finally {
      StructuredLogger.clearRequestContext();
    }
  }

  /**
   * Transcribe an object from the store, optionally writing the transcript next to it.
   *
   * @param bucket the bucket, or null for the configured default bucket
   * @throws com.scholary.speech.gateway.objectstore.ObjectStoreException if the object can't be
   *     read or the transcript can't be written
   */
  public FileResult transcribeObject(
      String bucket, String key, boolean save, Caller caller) throws IOException {
    if (bucket == null || bucket.isBlank()) {
      bucket = objectStoreProperties.bucket();
    }
    ObjectMetadata metadata = objectStoreClient.getObjectMetadata(bucket, key);
    LOGGER.info(
        "Fetching object: bucket={}, key={}, bytes={}", bucket, key, metadata.contentLength());

    Path workDir = Files.createDirectories(Paths.get(properties.tempDir()));
    Path local = Files.createTempFile(workDir, "object-", extensionOf(key));
    try {
      try (InputStream in = objectStoreClient.getObjectStream(bucket, key)) {
        Files.copy(in, local, StandardCopyOption.REPLACE_EXISTING);
      }
      FileResult result = transcribeFile(local, caller);
      if (!save) {
        return result;
      }
      String transcriptKey = transcriptKey(key);
      byte[] bytes = result.text().getBytes(StandardCharsets.UTF_8);
      objectStoreClient.putObject(
          bucket,
          transcriptKey,
          new ByteArrayInputStream(bytes),
          bytes.length,
          "text/plain; charset=utf-8");
      LOGGER.info("Saved transcript: bucket={}, key={}", bucket, transcriptKey);
      return result.withSavedKey(transcriptKey);
    } finally {
      Files.deleteIfExists(local);
    }
  }

  /** {@code audio/meeting.mp3} becomes {@code audio/meeting.txt}. */
  static String transcriptKey(String key) {
    int slash = key.lastIndexOf('/');
    int dot = key.lastIndexOf('.');
    String base = dot > slash ? key.substring(0, dot) : key;
    return base + ".txt";
  }

  private static String extensionOf(String key) {
    int slash = key.lastIndexOf('/');
    int dot = key.lastIndexOf('.');
    return dot > slash ? key.substring(dot) : ".audio";
  }
}
