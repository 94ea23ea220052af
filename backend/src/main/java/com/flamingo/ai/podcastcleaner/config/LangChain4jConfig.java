package com.flamingo.ai.podcastcleaner.config;

import com.flamingo.ai.podcastcleaner.exception.ConfigurationException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * Configuration for LangChain4j models.
 *
 * <p>The chat model is lazy so the application starts without a key; submissions check for the
 * key before any pipeline needs the model.
 */
@Configuration
@RequiredArgsConstructor
public class LangChain4jConfig {

  private final GeminiProperties geminiProperties;

  @Bean
  @Lazy
  public ChatModel chatModel() {
    validateApiKey();

    return OpenAiChatModel.builder()
        .baseUrl(geminiProperties.getBaseUrl())
        .apiKey(geminiProperties.getApiKey())
        .modelName(geminiProperties.getModelName())
        .timeout(Duration.ofSeconds(geminiProperties.getTimeoutSeconds()))
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  private void validateApiKey() {
    if (!geminiProperties.hasApiKey()) {
      throw new ConfigurationException(
          "Gemini API key is required. Set GOOGLE_API_KEY environment variable.");
    }
  }
}
