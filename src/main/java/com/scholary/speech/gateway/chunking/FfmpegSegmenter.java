package com.scholary.speech.gateway.chunking;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Measures and splits audio files with ffprobe and ffmpeg.
 *
 * <p>Splitting uses the segment muxer with stream copy, so every output file starts on a packet
 * boundary and carries its own container header:
 *
 * <pre>
 * ffmpeg -y -i input -f segment -segment_time N -c copy -reset_timestamps 1 -map 0 chunk_%03d.ext
 * </pre>
 *
 * <p>Process output goes to a log file next to the outputs rather than a pipe, so a chatty ffmpeg
 * can't block on a full buffer while we wait for it with a timeout.
 */
@Component
public class FfmpegSegmenter {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegSegmenter.class);

  static final String SEGMENT_PREFIX = "chunk_";

  private final FfmpegProperties properties;

  public FfmpegSegmenter(FfmpegProperties properties) {
    this.properties = properties;
  }

  /**
   * Get the playing time of an audio file.
   *
   * @throws IOException if ffprobe fails or prints something that isn't a duration
   */
  public Duration measureDuration(Path file) throws IOException {
    LOGGER.debug("Getting duration with ffprobe: file={}", file);

    Path output = Files.createTempFile("ffprobe-", ".out");
    try {
      run(
          List.of(
              properties.ffprobePath(),
              "-v",
              "error",
              "-show_entries",
              "format=duration",
              "-of",
              "default=noprint_wrappers=1:nokey=1",
              file.toString()),
          output);

      String text = Files.readString(output, StandardCharsets.UTF_8).trim();
      try {
        double seconds = Double.parseDouble(text);
        return Duration.ofMillis(Math.round(seconds * 1000));
      } catch (NumberFormatException e) {
        throw new IOException("Failed to parse duration from ffprobe output: " + text, e);
      }
    } finally {
      Files.deleteIfExists(output);
    }
  }

  /**
   * Split a file into boundary-aligned segments.
   *
   * <p>The segmenter is retried {@code ffmpeg.max-retries} times, with a fixed delay, before the
   * last error is rethrown. Partial output from a failed attempt is removed first.
   *
   * @param input the source file
   * @param outputDir an empty directory that receives the segments
   * @param container the source container; segments keep it
   * @return the segment files in playback order
   * @throws IOException if every attempt fails
   */
  public List<Path> segment(Path input, Path outputDir, AudioContainer container)
      throws IOException {
    long segmentSeconds = Math.max(1, properties.segmentLength().toSeconds());
    String pattern =
        outputDir.resolve(SEGMENT_PREFIX + "%03d." + container.extension()).toString();

    List<String> command =
        List.of(
            properties.ffmpegPath(),
            "-nostdin",
            "-y",
            "-i",
            input.toString(),
            "-f",
            "segment",
            "-segment_time",
            String.valueOf(segmentSeconds),
            "-c",
            "copy",
            "-reset_timestamps",
            "1",
            "-map",
            "0",
            pattern);

    int attempts = properties.maxRetries() + 1;
    IOException lastException = null;

    for (int attempt = 1; attempt <= attempts; attempt++) {
      try {
        run(command, outputDir.resolve("ffmpeg.log"));
        List<Path> segments = listSegments(outputDir);
        if (segments.isEmpty()) {
          throw new IOException("ffmpeg produced no segments for " + input.getFileName());
        }
        LOGGER.info(
            "Segmented file: file={}, segments={}, segmentTime={}s",
            input.getFileName(),
            segments.size(),
            segmentSeconds);
        return segments;
      } catch (IOException e) {
        lastException = e;
        removeSegments(outputDir);
        if (attempt < attempts) {
          LOGGER.warn(
              "Segmenting attempt {}/{} failed, retrying in {}ms: {}",
              attempt,
              attempts,
              properties.retryDelay().toMillis(),
              e.getMessage());
          sleep(properties.retryDelay());
        }
      }
    }
    throw lastException;
  }

  static List<Path> listSegments(Path dir) throws IOException {
    try (Stream<Path> files = Files.list(dir)) {
      return files
          .filter(p -> p.getFileName().toString().startsWith(SEGMENT_PREFIX))
          .sorted()
          .toList();
    }
  }

  private void removeSegments(Path dir) throws IOException {
    for (Path segment : listSegments(dir)) {
      Files.deleteIfExists(segment);
    }
  }

  private void run(List<String> command, Path output) throws IOException {
    LOGGER.debug("Executing: {}", String.join(" ", command));

    ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
    pb.redirectErrorStream(true);
    pb.redirectOutput(output.toFile());

    Process process = pb.start();
    try {
      if (!process.waitFor(properties.processTimeoutSeconds(), TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw new IOException(
            String.format(
                "%s timed out after %ds", command.get(0), properties.processTimeoutSeconds()));
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new IOException(command.get(0) + " interrupted", e);
    }

    if (process.exitValue() != 0) {
      String log = Files.readString(output, StandardCharsets.UTF_8);
      throw new IOException(
          String.format(
              "%s failed with exit code %d: %s", command.get(0), process.exitValue(), tail(log)));
    }
  }

  private static String tail(String log) {
    return log.length() <= 500 ? log.trim() : log.substring(log.length() - 500).trim();
  }

  private static void sleep(Duration delay) throws IOException {
    try {
      Thread.sleep(delay.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("Segmenting interrupted", e);
    }
  }
}
