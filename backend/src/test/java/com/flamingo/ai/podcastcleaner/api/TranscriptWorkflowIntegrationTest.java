package com.flamingo.ai.podcastcleaner.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.podcastcleaner.agent.HighlightAgent;
import com.flamingo.ai.podcastcleaner.agent.TranscriptCleaningAgent;
import com.flamingo.ai.podcastcleaner.domain.VideoInfo;
import com.flamingo.ai.podcastcleaner.exception.TranscriptUnavailableException;
import com.flamingo.ai.podcastcleaner.service.metadata.VideoMetadataService;
import com.flamingo.ai.podcastcleaner.service.render.image.RemoteImageFetcher;
import com.flamingo.ai.podcastcleaner.service.transcript.TranscriptExtractor;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Drives a submission through the real asynchronous pipeline with the external collaborators
 * (oEmbed, yt-dlp, Gemini, image downloads) mocked, then downloads both renditions.
 */
@SpringBootTest(properties = "gemini.api-key=test-key")
@AutoConfigureMockMvc
class TranscriptWorkflowIntegrationTest {

  private static final String TAKEAWAYS =
      "- First point\n- Second point\n- Third point\n- Fourth point\n- Fifth point";

  @TempDir static Path cacheDir;

  @MockitoBean private VideoMetadataService videoMetadataService;
  @MockitoBean private TranscriptExtractor transcriptExtractor;
  @MockitoBean private TranscriptCleaningAgent transcriptCleaningAgent;
  @MockitoBean private HighlightAgent highlightAgent;
  @MockitoBean private RemoteImageFetcher remoteImageFetcher;

  @Autowired private MockMvc mockMvc;
  @Autowired private ObjectMapper objectMapper;

  @DynamicPropertySource
  static void cacheProperties(DynamicPropertyRegistry registry) {
    registry.add("pipeline.cache.file", () -> cacheDir.resolve("cache.json").toString());
  }

  private String submit(String url) throws Exception {
    String body =
        mockMvc
            .perform(
                post("/transcribe")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"url\":\"" + url + "\"}"))
            .andExpect(status().isOk())
            .andReturn()
            .getResponse()
            .getContentAsString();
    return objectMapper.readTree(body).get("job_id").asText();
  }

  private JsonNode awaitTerminal(String jobId) {
    return await()
        .atMost(Duration.ofSeconds(10))
        .pollInterval(Duration.ofMillis(50))
        .until(
            () -> {
              String body =
                  mockMvc
                      .perform(get("/status/{jobId}", jobId))
                      .andReturn()
                      .getResponse()
                      .getContentAsString();
              return objectMapper.readTree(body);
            },
            node -> !"processing".equals(node.get("status").asText()));
  }

  @Test
  @DisplayName("should complete a job, serve it from the cache and download both formats")
  void shouldProcessAndServeFromCache_whenVideoSubmittedTwice() throws Exception {
    when(videoMetadataService.fetchVideoInfo("dQw4w9WgXcQ"))
        .thenReturn(new VideoInfo("Deep Talk", "dQw4w9WgXcQ"));
    when(transcriptExtractor.extractTranscript(eq("dQw4w9WgXcQ"), anyString()))
        .thenReturn("um so welcome to the show today we talk");
    when(transcriptCleaningAgent.clean(eq("Deep Talk"), anyString()))
        .thenReturn("## Introduction\n\nWelcome to the show. Today we **talk**.");
    when(highlightAgent.extractTakeaways(eq("Deep Talk"), anyString())).thenReturn(TAKEAWAYS);

    String jobId = submit("https://www.youtube.com/watch?v=dQw4w9WgXcQ");
    JsonNode done = awaitTerminal(jobId);

    assertThat(done.get("status").asText()).isEqualTo("completed");
    assertThat(done.at("/result/title").asText()).isEqualTo("Deep Talk");
    assertThat(done.at("/result/filename").asText()).isEqualTo("Deep_Talk.md");
    assertThat(done.at("/result/markdown").asText())
        .contains("\n# Deep Talk\n")
        .contains("- Fifth point")
        .contains("## Introduction");
    assertThat(Files.readString(cacheDir.resolve("cache.json"))).contains("dQw4w9WgXcQ");

    String cachedJobId = submit("https://youtu.be/dQw4w9WgXcQ");
    assertThat(cachedJobId).isNotEqualTo(jobId);
    mockMvc
        .perform(get("/status/{jobId}", cachedJobId))
        .andExpect(jsonPath("$.status").value("completed"))
        .andExpect(jsonPath("$.progress").value("Loaded from cache"));
    verify(transcriptCleaningAgent, times(1)).clean(anyString(), anyString());

    mockMvc
        .perform(get("/download/{jobId}", cachedJobId))
        .andExpect(status().isOk())
        .andExpect(content().string(done.at("/result/markdown").asText()));

    byte[] pdf =
        mockMvc
            .perform(
                get("/download/{jobId}/pdf", jobId).param("font", "Georgia").param("zoom", "120"))
            .andExpect(status().isOk())
            .andExpect(content().contentType(MediaType.APPLICATION_PDF))
            .andReturn()
            .getResponse()
            .getContentAsByteArray();
    try (PDDocument document = Loader.loadPDF(pdf)) {
      String text = new PDFTextStripper().getText(document);
      assertThat(text).contains("Deep Talk").contains("Welcome to the show.");
    }
  }

  @Test
  @DisplayName("should surface a stage failure as an error status")
  void shouldReportError_whenTranscriptMissing() throws Exception {
    when(videoMetadataService.fetchVideoInfo("aaaaaaaaaaa"))
        .thenReturn(new VideoInfo("Silent", "aaaaaaaaaaa"));
    when(transcriptExtractor.extractTranscript(eq("aaaaaaaaaaa"), anyString()))
        .thenThrow(
            new TranscriptUnavailableException(
                "aaaaaaaaaaa", "No transcript found for this video"));

    String jobId = submit("aaaaaaaaaaa");
    JsonNode failed = awaitTerminal(jobId);

    assertThat(failed.get("status").asText()).isEqualTo("error");
    assertThat(failed.get("error").asText()).isEqualTo("No transcript found for this video");
    mockMvc.perform(get("/download/{jobId}", jobId)).andExpect(status().isBadRequest());
  }
}
