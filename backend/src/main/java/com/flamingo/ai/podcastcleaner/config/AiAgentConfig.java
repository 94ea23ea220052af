package com.flamingo.ai.podcastcleaner.config;

import com.flamingo.ai.podcastcleaner.agent.HighlightAgent;
import com.flamingo.ai.podcastcleaner.agent.TranscriptCleaningAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * Configuration for the AI agents, built with LangChain4j AI Services.
 *
 * <p>Pattern: Define agent interfaces with @UserMessage templates, build concrete implementations
 * using AiServices.builder(). Agents are lazy because the chat model is.
 */
@Configuration
public class AiAgentConfig {

  /** Transcript cleaning agent: turns raw captions into chaptered, readable markdown. */
  @Bean
  @Lazy
  public TranscriptCleaningAgent transcriptCleaningAgent(@Lazy ChatModel chatModel) {
    return AiServices.builder(TranscriptCleaningAgent.class).chatModel(chatModel).build();
  }

  /** Highlight agent: extracts the five top takeaways from a cleaned transcript. */
  @Bean
  @Lazy
  public HighlightAgent highlightAgent(@Lazy ChatModel chatModel) {
    return AiServices.builder(HighlightAgent.class).chatModel(chatModel).build();
  }
}
