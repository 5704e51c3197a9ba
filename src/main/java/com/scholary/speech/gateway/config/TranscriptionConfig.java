package com.scholary.speech.gateway.config;

import com.scholary.speech.gateway.chunking.AudioEncoderFactory;
import com.scholary.speech.gateway.chunking.JavaSoundWavEncoder;
import com.scholary.speech.gateway.transcript.OverlapDeduplicator;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for transcription-related beans.
 *
 * <p>Enables the TranscriptionProperties to be loaded from application.yml and exposes the UTC
 * clock every period and deadline calculation runs against.
 */
@Configuration
@EnableConfigurationProperties(TranscriptionProperties.class)
public class TranscriptionConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public OverlapDeduplicator overlapDeduplicator(TranscriptionProperties properties) {
    return new OverlapDeduplicator(properties.merge().windowWords());
  }

  /** Live sessions record from the default capture device of the host. */
  @Bean
  public AudioEncoderFactory audioEncoderFactory() {
    return JavaSoundWavEncoder::new;
  }
}
