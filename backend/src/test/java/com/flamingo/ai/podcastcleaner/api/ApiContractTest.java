package com.flamingo.ai.podcastcleaner.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.podcastcleaner.api.rest.HealthController;
import com.flamingo.ai.podcastcleaner.api.rest.TranscriptController;
import java.lang.reflect.Method;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests pinning the public endpoint paths. Browser front ends call these paths directly,
 * so a failure here means a client-visible route moved.
 */
class ApiContractTest {

  private static Method method(String name) {
    for (Method m : TranscriptController.class.getDeclaredMethods()) {
      if (m.getName().equals(name)) {
        return m;
      }
    }
    throw new AssertionError("No controller method " + name);
  }

  @Nested
  @DisplayName("TranscriptController API contract")
  class TranscriptControllerContract {

    @Test
    @DisplayName("should not carry a class-level prefix")
    void shouldNotHaveClassLevelPrefix() {
      assertThat(TranscriptController.class.getAnnotation(RequestMapping.class)).isNull();
    }

    @Test
    @DisplayName("should accept submissions on POST /transcribe")
    void shouldMapTranscribe() {
      PostMapping mapping = method("transcribe").getAnnotation(PostMapping.class);
      assertThat(mapping.value()).containsExactly("/transcribe");
    }

    @Test
    @DisplayName("should serve status on GET /status/{jobId}")
    void shouldMapStatus() {
      GetMapping mapping = method("status").getAnnotation(GetMapping.class);
      assertThat(mapping.value()).containsExactly("/status/{jobId}");
    }

    @Test
    @DisplayName("should serve downloads on GET /download/{jobId} and its /pdf variant")
    void shouldMapDownloads() {
      assertThat(method("downloadMarkdown").getAnnotation(GetMapping.class).value())
          .containsExactly("/download/{jobId}");
      assertThat(method("downloadPdf").getAnnotation(GetMapping.class).value())
          .containsExactly("/download/{jobId}/pdf");
    }
  }

  @Nested
  @DisplayName("HealthController API contract")
  class HealthControllerContract {

    @Test
    @DisplayName("should be mapped to /health")
    void shouldBeMappedToHealth() {
      RequestMapping mapping = HealthController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/health");
    }
  }
}
