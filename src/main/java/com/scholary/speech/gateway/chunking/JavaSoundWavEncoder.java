package com.scholary.speech.gateway.chunking;

import java.io.ByteArrayOutputStream;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.TargetDataLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Captures 16 kHz mono PCM from the default Java Sound input line and returns it as WAV.
 *
 * <p>Each start opens the line and a reader thread; each stop closes the line, waits for the
 * reader and wraps what it captured in a fresh RIFF header.
 */
public class JavaSoundWavEncoder implements AudioEncoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(JavaSoundWavEncoder.class);

  static final AudioFormat FORMAT =
      new AudioFormat(
          WavWriter.SAMPLE_RATE, WavWriter.BITS_PER_SAMPLE, WavWriter.CHANNELS, true, false);

  private static final int READ_BUFFER_BYTES = WavWriter.BYTE_RATE / 10;
  private static final long JOIN_TIMEOUT_MS = 2_000;

  /** Opens a started-ready line; replaced in tests. */
  @FunctionalInterface
  interface LineOpener {
    TargetDataLine open(AudioFormat format) throws LineUnavailableException;
  }

  private final LineOpener opener;

  private TargetDataLine line;
  private Thread reader;
  private ByteArrayOutputStream buffer;
  private volatile boolean capturing;

  public JavaSoundWavEncoder() {
    this(JavaSoundWavEncoder::openDefaultLine);
  }

  JavaSoundWavEncoder(LineOpener opener) {
    this.opener = opener;
  }

  private static TargetDataLine openDefaultLine(AudioFormat format)
      throws LineUnavailableException {
    TargetDataLine line =
        (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
    line.open(format);
    return line;
  }

  @Override
  public void start() {
    if (line != null) {
      throw new IllegalStateException("Encoder is already recording");
    }
    try {
      line = opener.open(FORMAT);
    } catch (LineUnavailableException | IllegalArgumentException e) {
      throw new AudioCaptureException("No usable audio input line", e);
    }
    buffer = new ByteArrayOutputStream();
    capturing = true;
    line.start();

    TargetDataLine active = line;
    ByteArrayOutputStream target = buffer;
    reader = new Thread(() -> capture(active, target), "live-capture");
    reader.setDaemon(true);
    reader.start();
  }

  private void capture(TargetDataLine active, ByteArrayOutputStream target) {
    byte[] data = new byte[READ_BUFFER_BYTES];
    while (capturing) {
      int read = active.read(data, 0, data.length);
      if (read > 0) {
        synchronized (target) {
          target.write(data, 0, read);
        }
      } else if (!active.isOpen()) {
        break;
      }
    }
  }

  @Override
  public byte[] stop() {
    if (line == null) {
      return new byte[0];
    }
    capturing = false;
    line.stop();
    line.close();
    try {
      reader.join(JOIN_TIMEOUT_MS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Interrupted while waiting for capture thread; returning what was read");
    }

    byte[] pcm;
    synchronized (buffer) {
      pcm = buffer.toByteArray();
    }
    line = null;
    reader = null;
    buffer = null;

    LOGGER.debug("Captured {} bytes of PCM", pcm.length);
    return pcm.length == 0 ? new byte[0] : WavWriter.toWav(pcm);
  }
}
