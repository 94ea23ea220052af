package com.flamingo.ai.podcastcleaner.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Connection settings for the Gemini language model, reached through its OpenAI-compatible
 * endpoint.
 */
@Configuration
@ConfigurationProperties(prefix = "gemini")
@Getter
@Setter
public class GeminiProperties {

  private String apiKey;
  private String baseUrl = "https://generativelanguage.googleapis.com/v1beta/openai/";
  private String modelName = "gemini-2.5-flash";
  private int timeoutSeconds = 300;

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }
}
