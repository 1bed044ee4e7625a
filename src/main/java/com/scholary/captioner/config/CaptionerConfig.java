package com.scholary.captioner.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for caption processing beans.
 *
 * <p>Enables the CaptionerProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(CaptionerProperties.class)
public class CaptionerConfig {}
