package com.scholary.speech.gateway.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.speech.gateway.testutil.TestAudio;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

/** Runs the segmenter against shell scripts standing in for ffmpeg and ffprobe. */
@DisabledOnOs(OS.WINDOWS)
class FfmpegSegmenterTest {

  @TempDir Path tempDir;

  private Path input;
  private Path outputDir;
  private Path attempts;

  @BeforeEach
  void setUp() throws IOException {
    input = Files.write(tempDir.resolve("lecture.webm"), TestAudio.webm());
    outputDir = Files.createDirectory(tempDir.resolve("segments"));
    attempts = tempDir.resolve("attempts");
  }

  @Test
  void segment_shouldRetryAfterAFailedAttemptAndReturnSegmentsInOrder() throws IOException {
    Path ffmpeg =
        script(
            "ffmpeg",
            countAttempt()
                + "printf partial > \"$dir/chunk_000.webm\"\n"
                + "if [ \"$n\" -eq 1 ]; then echo 'Invalid data found' >&2; exit 1; fi\n"
                + "printf one > \"$dir/chunk_000.webm\"\n"
                + "printf two > \"$dir/chunk_001.webm\"\n"
                + "printf three > \"$dir/chunk_002.webm\"\n");

    List<Path> segments =
        segmenter(ffmpeg, 2, 10).segment(input, outputDir, AudioContainer.WEBM);

    assertThat(segments)
        .extracting(p -> p.getFileName().toString())
        .containsExactly("chunk_000.webm", "chunk_001.webm", "chunk_002.webm");
    assertThat(Files.readString(segments.get(0))).isEqualTo("one");
    assertThat(attemptCount()).isEqualTo(2);
  }

  @Test
  void segment_shouldPassTheSegmentLengthAndPattern() throws IOException {
    Path args = tempDir.resolve("args");
    Path ffmpeg =
        script(
            "ffmpeg",
            countAttempt()
                + "echo \"$@\" > '"
                + args
                + "'\n"
                + "printf one > \"$dir/chunk_000.webm\"\n");

    segmenter(ffmpeg, 0, 10).segment(input, outputDir, AudioContainer.WEBM);

    assertThat(Files.readString(args))
        .contains("-f segment -segment_time 65 -c copy -reset_timestamps 1")
        .contains(input.toString())
        .endsWith(outputDir.resolve("chunk_%03d.webm") + "\n");
  }

  @Test
  void segment_nonZeroExitShouldFailAfterEveryRetryAndRemovePartialOutput() throws IOException {
    Path ffmpeg =
        script(
            "ffmpeg",
            countAttempt()
                + "printf partial > \"$dir/chunk_000.webm\"\n"
                + "echo 'moov atom not found' >&2\n"
                + "exit 3\n");

    FfmpegSegmenter segmenter = segmenter(ffmpeg, 2, 10);

    assertThatThrownBy(() -> segmenter.segment(input, outputDir, AudioContainer.WEBM))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("exit code 3")
        .hasMessageContaining("moov atom not found");
    assertThat(attemptCount()).isEqualTo(3);
    assertThat(FfmpegSegmenter.listSegments(outputDir)).isEmpty();
  }

  @Test
  void segment_successWithoutOutputShouldCountAsAFailure() throws IOException {
    Path ffmpeg = script("ffmpeg", countAttempt() + "exit 0\n");

    FfmpegSegmenter segmenter = segmenter(ffmpeg, 1, 10);

    assertThatThrownBy(() -> segmenter.segment(input, outputDir, AudioContainer.WEBM))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("produced no segments");
    assertThat(attemptCount()).isEqualTo(2);
  }

  @Test
  void segment_hungProcessShouldTimeOut() throws IOException {
    Path ffmpeg =
        script(
            "ffmpeg",
            countAttempt() + "printf partial > \"$dir/chunk_000.webm\"\n" + "exec sleep 30\n");

    FfmpegSegmenter segmenter = segmenter(ffmpeg, 0, 10);

    long started = System.nanoTime();
    assertThatThrownBy(() -> segmenter.segment(input, outputDir, AudioContainer.WEBM))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("timed out after 1s");

    assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(20));
    assertThat(FfmpegSegmenter.listSegments(outputDir)).isEmpty();
  }

  @Test
  void listSegments_shouldIgnoreOtherFilesAndSortByNumber() throws IOException {
    for (String name :
        List.of("chunk_010.ogg", "ffmpeg.log", "chunk_002.ogg", "notes.txt", "chunk_000.ogg")) {
      Files.writeString(outputDir.resolve(name), name);
    }

    assertThat(FfmpegSegmenter.listSegments(outputDir))
        .extracting(p -> p.getFileName().toString())
        .containsExactly("chunk_000.ogg", "chunk_002.ogg", "chunk_010.ogg");
  }

  @Test
  void measureDuration_shouldParseSecondsToMillis() throws IOException {
    Path ffprobe = script("ffprobe", "echo 150.2504\n");

    assertThat(durationReader(ffprobe).measureDuration(input))
        .isEqualTo(Duration.ofMillis(150250));
  }

  @Test
  void measureDuration_unparseableOutputShouldFail() throws IOException {
    Path ffprobe = script("ffprobe", "echo N/A\n");

    assertThatThrownBy(() -> durationReader(ffprobe).measureDuration(input))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("Failed to parse duration")
        .hasMessageContaining("N/A");
  }

  @Test
  void measureDuration_failingProcessShouldFail() throws IOException {
    Path ffprobe = script("ffprobe", "echo 'No such file or directory' >&2\nexit 1\n");

    assertThatThrownBy(() -> durationReader(ffprobe).measureDuration(input))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("exit code 1")
        .hasMessageContaining("No such file or directory");
  }

  private FfmpegSegmenter segmenter(Path ffmpeg, int maxRetries, long retryDelayMillis) {
    return new FfmpegSegmenter(
        new FfmpegProperties(
            ffmpeg.toString(),
            "ffprobe",
            Duration.ofSeconds(65),
            maxRetries,
            Duration.ofMillis(retryDelayMillis),
            1));
  }

  private FfmpegSegmenter durationReader(Path ffprobe) {
    return new FfmpegSegmenter(
        new FfmpegProperties(
            "ffmpeg", ffprobe.toString(), Duration.ofSeconds(65), 0, Duration.ZERO, 5));
  }

  /** Shell prelude: bumps the attempt counter into $n and puts the output directory in $dir. */
  private String countAttempt() {
    return "n=$(cat '"
        + attempts
        + "' 2>/dev/null || echo 0)\n"
        + "n=$((n + 1))\n"
        + "echo $n > '"
        + attempts
        + "'\n"
        + "for last; do :; done\n"
        + "dir=$(dirname \"$last\")\n";
  }

  private int attemptCount() throws IOException {
    return Integer.parseInt(Files.readString(attempts).trim());
  }

  private Path script(String name, String body) throws IOException {
    Path file = tempDir.resolve(name);
    Files.writeString(file, "#!/bin/sh\n" + body, StandardCharsets.UTF_8);
    assertThat(file.toFile().setExecutable(true)).isTrue();
    return file;
  }
}
