package com.flamingo.ai.podcastcleaner;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.podcastcleaner.service.cache.ResultCache;
import com.flamingo.ai.podcastcleaner.service.job.TranscriptJobService;
import com.flamingo.ai.podcastcleaner.service.job.TranscriptPipeline;
import com.flamingo.ai.podcastcleaner.service.render.DocumentRenderService;
import dev.langchain4j.model.chat.ChatModel;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the Spring application context loads without an API key or any external service. The
 * chat model is mocked and the result cache points at a temporary directory.
 */
@SpringBootTest
class ApplicationContextTest {

  @TempDir static Path cacheDir;

  @MockitoBean private ChatModel chatModel;

  @Autowired private ApplicationContext applicationContext;

  @DynamicPropertySource
  static void cacheProperties(DynamicPropertyRegistry registry) {
    registry.add("pipeline.cache.file", () -> cacheDir.resolve("cache.json").toString());
  }

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(TranscriptJobService.class)).isNotNull();
    assertThat(applicationContext.getBean(TranscriptPipeline.class)).isNotNull();
    assertThat(applicationContext.getBean(ResultCache.class)).isNotNull();
    assertThat(applicationContext.getBean(DocumentRenderService.class)).isNotNull();
  }
}
