package com.scholary.speech.gateway.config;

import com.scholary.speech.gateway.provider.ProviderProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables the speech provider endpoints and the fallback model table. */
@Configuration
@EnableConfigurationProperties(ProviderProperties.class)
public class ProviderConfig {}
