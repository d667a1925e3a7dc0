package com.scholary.captions.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.captions.inference.GeminiClient;
import com.scholary.captions.inference.GeminiProperties;
import com.scholary.captions.inference.InferenceService;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the inference client.
 *
 * <p>Binds GeminiProperties from application.yml and exposes the Gemini client as the
 * InferenceService.
 */
@Configuration
@EnableConfigurationProperties(GeminiProperties.class)
public class GeminiConfig {

  @Bean
  public InferenceService inferenceService(GeminiProperties properties, ObjectMapper objectMapper) {
    return new GeminiClient(properties, objectMapper);
  }
}
