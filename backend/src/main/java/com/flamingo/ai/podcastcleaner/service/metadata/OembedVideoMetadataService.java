package com.flamingo.ai.podcastcleaner.service.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.podcastcleaner.config.PipelineProperties;
import com.flamingo.ai.podcastcleaner.domain.VideoInfo;
import com.flamingo.ai.podcastcleaner.exception.MetadataUnavailableException;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

/** {@link VideoMetadataService} backed by YouTube's oEmbed endpoint, which needs no API key. */
@Service
@Slf4j
public class OembedVideoMetadataService implements VideoMetadataService {

  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final PipelineProperties.Metadata settings;

  public OembedVideoMetadataService(
      @Qualifier("metadataWebClient") WebClient webClient,
      ObjectMapper objectMapper,
      PipelineProperties pipelineProperties) {
    this.webClient = webClient;
    this.objectMapper = objectMapper;
    this.settings = pipelineProperties.getMetadata();
  }

  @Override
  public VideoInfo fetchVideoInfo(String videoId) {
    URI endpoint = URI.create(settings.getOembedUrl().replace("{videoId}", videoId));
    log.debug("Fetching oEmbed metadata for video {}", videoId);
    try {
      String payload =
          webClient
              .get()
              .uri(endpoint)
              .retrieve()
              .bodyToMono(String.class)
              .timeout(Duration.ofMillis(settings.getTimeoutMs()))
              .block();
      return new VideoInfo(parseTitle(payload), videoId);
    } catch (IOException | RuntimeException e) {
      throw new MetadataUnavailableException(
          videoId, "Failed to get video info: " + e.getMessage(), e);
    }
  }

  private String parseTitle(String payload) throws IOException {
    if (payload == null || payload.isBlank()) {
      return settings.getFallbackTitle();
    }
    JsonNode node = objectMapper.readTree(payload);
    if (!node.hasNonNull("title")) {
      return settings.getFallbackTitle();
    }
    String title = node.get("title").asText();
    return title.isBlank() ? settings.getFallbackTitle() : title;
  }
}
