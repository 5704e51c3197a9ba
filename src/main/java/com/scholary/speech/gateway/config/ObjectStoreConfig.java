package com.scholary.speech.gateway.config;

import com.scholary.speech.gateway.objectstore.ObjectStoreClient;
import com.scholary.speech.gateway.objectstore.ObjectStoreProperties;
import com.scholary.speech.gateway.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>Wires the S3-compatible client that stored recordings are read from and transcripts are
 * written to.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}
