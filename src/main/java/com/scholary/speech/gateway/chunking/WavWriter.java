package com.scholary.speech.gateway.chunking;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Duration;
import java.util.Objects;

/**
 * Wraps raw PCM in a RIFF/WAVE header.
 *
 * <p>Format: 16 kHz, 16-bit signed PCM, mono, little-endian. Only this fixed format is
 * supported.
 */
public final class WavWriter {

  public static final int SAMPLE_RATE = 16_000;
  public static final int BITS_PER_SAMPLE = 16;
  public static final int CHANNELS = 1;
  public static final int BLOCK_ALIGN = CHANNELS * BITS_PER_SAMPLE / 8;
  public static final int BYTE_RATE = SAMPLE_RATE * BLOCK_ALIGN;

  private WavWriter() {}

  /**
   * Build a WAV file around the given PCM16LE mono 16 kHz payload.
   *
   * @param pcm raw samples
   * @return header plus samples
   */
  public static byte[] toWav(byte[] pcm) {
    Objects.requireNonNull(pcm, "pcm must not be null");
    ByteBuffer buffer =
        ByteBuffer.allocate(AudioContainer.WAV_HEADER_BYTES + pcm.length)
            .order(ByteOrder.LITTLE_ENDIAN);

    buffer.put(new byte[] {'R', 'I', 'F', 'F'});
    buffer.putInt(36 + pcm.length);
    buffer.put(new byte[] {'W', 'A', 'V', 'E'});

    buffer.put(new byte[] {'f', 'm', 't', ' '});
    buffer.putInt(16);
    buffer.putShort((short) 1);
    buffer.putShort((short) CHANNELS);
    buffer.putInt(SAMPLE_RATE);
    buffer.putInt(BYTE_RATE);
    buffer.putShort((short) BLOCK_ALIGN);
    buffer.putShort((short) BITS_PER_SAMPLE);

    buffer.put(new byte[] {'d', 'a', 't', 'a'});
    buffer.putInt(pcm.length);
    buffer.put(pcm);

    return buffer.array();
  }

  /**
   * Playing time of a canonical 44-byte-header WAV file, derived from its byte rate.
   *
   * @return the duration, or {@link Duration#ZERO} if the header is missing or unusable
   */
  public static Duration duration(byte[] wav) {
    if (AudioContainer.detect(wav).orElse(null) != AudioContainer.WAV
        || wav.length < AudioContainer.WAV_HEADER_BYTES) {
      return Duration.ZERO;
    }
    int byteRate = ByteBuffer.wrap(wav, 28, 4).order(ByteOrder.LITTLE_ENDIAN).getInt();
    if (byteRate <= 0) {
      return Duration.ZERO;
    }
    long dataBytes = wav.length - (long) AudioContainer.WAV_HEADER_BYTES;
    return Duration.ofMillis(dataBytes * 1000 / byteRate);
  }
}
