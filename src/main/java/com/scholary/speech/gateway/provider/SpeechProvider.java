package com.scholary.speech.gateway.provider;

import com.scholary.speech.gateway.chunking.AudioContainer;

/**
 * A third-party speech-to-text backend.
 *
 * <p>Implementations are registered as beans and looked up by {@link #name()}, which matches the
 * provider column of the model catalog.
 */
public interface SpeechProvider {

  String name();

  /**
   * Transcribe one self-contained piece of audio.
   *
   * @param audio complete container bytes
   * @param container the audio's container, used for file naming and MIME type
   * @param language ISO language code, or {@code auto}
   * @param model canonical model identifier
   * @return the recognized text
   * @throws ProviderException on quota errors, unsupported models or transport failures that
   *     survive the provider's own retries
   */
  String transcribe(byte[] audio, AudioContainer container, String language, String model);
}
