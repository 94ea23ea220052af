package com.flamingo.ai.podcastcleaner.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for async operations. */
@Configuration
@EnableAsync
public class AsyncConfig {

  /** One task per in-flight transcript job. */
  @Bean(name = "pipelineExecutor")
  public Executor pipelineExecutor(PipelineProperties pipelineProperties) {
    PipelineProperties.Executor settings = pipelineProperties.getExecutor();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(settings.getCorePoolSize());
    executor.setMaxPoolSize(settings.getMaxPoolSize());
    executor.setQueueCapacity(settings.getQueueCapacity());
    executor.setThreadNamePrefix("pipeline-");
    executor.initialize();
    return executor;
  }
}
