package com.scholary.speech.gateway.chunking;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

/**
 * Audio container formats we accept, recognized by their leading bytes.
 *
 * <p>A chunk whose bytes don't start with one of these headers can't be decoded on its own and
 * must not be sent to a provider.
 */
public enum AudioContainer {
  WEBM("webm", "audio/webm"),
  OGG("ogg", "audio/ogg"),
  WAV("wav", "audio/wav"),
  MP3("mp3", "audio/mpeg"),
  MP4("m4a", "audio/mp4"),
  FLAC("flac", "audio/flac");

  /** Size of the canonical PCM WAV header. */
  static final int WAV_HEADER_BYTES = 44;

  private static final byte[] EBML = {0x1A, 0x45, (byte) 0xDF, (byte) 0xA3};

  private final String extension;
  private final String contentType;

  AudioContainer(String extension, String contentType) {
    this.extension = extension;
    this.contentType = contentType;
  }

  public String extension() {
    return extension;
  }

  public String contentType() {
    return contentType;
  }

  /** Identify the container from the first bytes of a file or chunk. */
  public static Optional<AudioContainer> detect(byte[] head) {
    if (head == null || head.length < 4) {
      return Optional.empty();
    }
    if (startsWith(head, 0, EBML)) {
      return Optional.of(WEBM);
    }
    if (startsWith(head, 0, ascii("OggS"))) {
      return Optional.of(OGG);
    }
    if (startsWith(head, 0, ascii("RIFF")) && startsWith(head, 8, ascii("WAVE"))) {
      return Optional.of(WAV);
    }
    if (startsWith(head, 0, ascii("fLaC"))) {
      return Optional.of(FLAC);
    }
    if (startsWith(head, 4, ascii("ftyp"))) {
      return Optional.of(MP4);
    }
    if (startsWith(head, 0, ascii("ID3"))) {
      return Optional.of(MP3);
    }
    // MPEG audio frame sync: eleven set bits
    if ((head[0] & 0xFF) == 0xFF && (head[1] & 0xE0) == 0xE0) {
      return Optional.of(MP3);
    }
    return Optional.empty();
  }

  /**
   * Explain why the bytes can't be used as a standalone chunk.
   *
   * @return empty when the audio looks decodable, otherwise a short reason
   */
  public static Optional<String> problem(byte[] audio) {
    if (audio == null || audio.length == 0) {
      return Optional.of("empty");
    }
    Optional<AudioContainer> container = detect(audio);
    if (container.isEmpty()) {
      return Optional.of("no recognizable container header");
    }
    if (container.get() == WAV && audio.length <= WAV_HEADER_BYTES) {
      return Optional.of("header without samples");
    }
    return Optional.empty();
  }

  /**
   * Reject a chunk that can't be decoded on its own.
   *
   * @throws ChunkInvalidException if the chunk is empty or has no container header
   */
  public static AudioContainer requireDecodable(Chunk chunk) {
    problem(chunk.audio())
        .ifPresent(
            reason -> {
              throw new ChunkInvalidException(chunk.sequenceNumber(), reason);
            });
    return detect(chunk.audio()).orElseThrow();
  }

  private static boolean startsWith(byte[] data, int offset, byte[] prefix) {
    if (data.length < offset + prefix.length) {
      return false;
    }
    return Arrays.equals(data, offset, offset + prefix.length, prefix, 0, prefix.length);
  }

  private static byte[] ascii(String value) {
    return value.getBytes(StandardCharsets.US_ASCII);
  }
}
