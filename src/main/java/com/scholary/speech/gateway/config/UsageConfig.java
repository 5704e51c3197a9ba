package com.scholary.speech.gateway.config;

import com.scholary.speech.gateway.usage.UsageProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables the usage ledger and monthly reset settings. */
@Configuration
@EnableConfigurationProperties(UsageProperties.class)
public class UsageConfig {}
