package com.scholary.speech.gateway.config;

import com.scholary.speech.gateway.access.AccessProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables the model access settings: baseline model, check deadlines and alias overrides. */
@Configuration
@EnableConfigurationProperties(AccessProperties.class)
public class AccessConfig {}
