package com.scholary.speech.gateway.chunking;

import com.scholary.speech.gateway.config.TranscriptionProperties;
import com.scholary.speech.gateway.logging.StructuredLogger;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a pre-recorded file into a finite, lazy stream of independently decodable chunks.
 *
 * <p>Files within both the size and the duration limit pass through as a single chunk. Larger
 * files are split by {@link FfmpegSegmenter}. Segment files are read one at a time as the stream
 * is consumed, and the temporary directory is deleted when the stream is closed, so callers must
 * use try-with-resources.
 */
@Component
public class OfflineSegmentProducer {

  private static final Logger LOGGER = LoggerFactory.getLogger(OfflineSegmentProducer.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private static final int HEADER_PROBE_BYTES = 16;

  private final FfmpegSegmenter segmenter;
  private final FfmpegProperties ffmpegProperties;
  private final TranscriptionProperties properties;

  public OfflineSegmentProducer(
      FfmpegSegmenter segmenter,
      FfmpegProperties ffmpegProperties,
      TranscriptionProperties properties) {
    this.segmenter = segmenter;
    this.ffmpegProperties = ffmpegProperties;
    this.properties = properties;
  }

  /**
   * Produce chunks for a file.
   *
   * @param source the audio file; left untouched
   * @param sessionId identifies the chunks' origin in logs and accounting
   * @return chunks in playback order; close it to release temporary files
   * @throws ChunkInvalidException if the file has no recognizable audio container
   * @throws IOException if probing or segmenting fails
   */
  public Stream<Chunk> produce(Path source, String sessionId) throws IOException {
    AudioContainer container =
        AudioContainer.detect(readHead(source))
            .orElseThrow(() -> new ChunkInvalidException(0, "no recognizable container header"));

    long size = Files.size(source);
    Duration total = segmenter.measureDuration(source);
    TranscriptionProperties.LimitProperties limits = properties.limits();

    if (size <= limits.maxFileBytes() && total.toSeconds() <= limits.maxFileSeconds()) {
      LOGGER.info(
          "File within limits, sending as one chunk: file={}, bytes={}, duration={}",
          source.getFileName(),
          size,
          total);
      return Stream.of(new Chunk(0, Files.readAllBytes(source), total, sessionId));
    }

    LOGGER.info(
        "File exceeds limits, segmenting: file={}, bytes={}, duration={}, segmentLength={}",
        source.getFileName(),
        size,
        total,
        ffmpegProperties.segmentLength());

    Path workDir = Files.createDirectories(Paths.get(properties.tempDir()));
    Path segmentDir = Files.createTempDirectory(workDir, "segments-");
    try {
      List<Path> segments = segmenter.segment(source, segmentDir, container);
      return readSegments(segments, sessionId, total, ffmpegProperties.segmentLength())
          .onClose(() -> deleteDirectory(segmentDir));
    } catch (IOException | RuntimeException e) {
      deleteDirectory(segmentDir);
      throw e;
    }
  }

  /**
   * Lazily read segment files as chunks. Segments without a decodable header are logged and
   * skipped; their sequence number is not reused.
   */
  Stream<Chunk> readSegments(
      List<Path> segments, String sessionId, Duration total, Duration segmentLength) {
    int count = segments.size();
    return IntStream.range(0, count)
        .mapToObj(
            index -> {
              byte[] audio = read(segments.get(index));
              Optional<String> problem = AudioContainer.problem(audio);
              if (problem.isPresent()) {
                STRUCTURED_LOGGER.logChunkInvalid(sessionId, index, audio.length, problem.get());
                return null;
              }
              Duration hint = durationHint(index, count, total, segmentLength);
              STRUCTURED_LOGGER.logChunkEmitted(sessionId, index, audio.length, hint.toMillis());
              return new Chunk(index, audio, hint, sessionId);
            })
        .filter(Objects::nonNull);
  }

  /** Every segment but the last runs the full length; the last gets the remainder. */
  static Duration durationHint(int index, int count, Duration total, Duration segmentLength) {
    if (index < count - 1) {
      return segmentLength;
    }
    Duration remainder = total.minus(segmentLength.multipliedBy(count - 1L));
    return remainder.isNegative() || remainder.isZero() ? segmentLength : remainder;
  }

  private static byte[] readHead(Path source) throws IOException {
    try (InputStream in = Files.newInputStream(source)) {
      return in.readNBytes(HEADER_PROBE_BYTES);
    }
  }

  private static byte[] read(Path segment) {
    try {
      return Files.readAllBytes(segment);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read segment " + segment.getFileName(), e);
    }
  }

  private static void deleteDirectory(Path dir) {
    try (Stream<Path> paths = Files.walk(dir)) {
      for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
        Files.deleteIfExists(path);
      }
    } catch (IOException e) {
      LOGGER.warn("Failed to delete segment directory {}: {}", dir, e.getMessage());
    }
  }
}
