package com.scholary.captioner.config;

import com.scholary.captioner.generation.ModelServerProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the model server client.
 *
 * <p>Enables the ModelServerProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(ModelServerProperties.class)
public class ModelServerConfig {}
