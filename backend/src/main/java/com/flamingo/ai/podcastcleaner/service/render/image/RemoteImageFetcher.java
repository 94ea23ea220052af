package com.flamingo.ai.podcastcleaner.service.render.image;

import com.flamingo.ai.podcastcleaner.config.RenderProperties;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import javax.imageio.ImageIO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Downloads and decodes images referenced by documents.
 *
 * <p>Never throws: an unreachable, oversized or undecodable image yields an empty result and the
 * renderer leaves it out.
 */
@Component
@Slf4j
public class RemoteImageFetcher {

  private final WebClient webClient;
  private final RenderProperties.Image settings;

  public RemoteImageFetcher(
      @Qualifier("imageWebClient") WebClient webClient, RenderProperties renderProperties) {
    this.webClient = webClient;
    this.settings = renderProperties.getImage();
  }

  public Optional<BufferedImage> fetch(String url) {
    if (!isHttpUrl(url)) {
      log.warn("Skipping image with unsupported URL: {}", url);
      return Optional.empty();
    }
    try {
      byte[] bytes =
          webClient
              .get()
              .uri(URI.create(url.strip()))
              .retrieve()
              .bodyToMono(byte[].class)
              .timeout(Duration.ofMillis(settings.getTimeoutMs()))
              .block();
      if (bytes == null || bytes.length == 0) {
        log.warn("Image {} returned no content", url);
        return Optional.empty();
      }
      BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
      if (image == null) {
        log.warn("Image {} is not in a readable format", url);
        return Optional.empty();
      }
      log.debug("Fetched image {} ({}x{})", url, image.getWidth(), image.getHeight());
      return Optional.of(image);
    } catch (IOException | RuntimeException e) {
      log.warn("Failed to fetch image {}: {}", url, e.getMessage());
      return Optional.empty();
    }
  }

  private boolean isHttpUrl(String url) {
    if (url == null) {
      return false;
    }
    String lower = url.strip().toLowerCase(Locale.ROOT);
    return lower.startsWith("http://") || lower.startsWith("https://");
  }
}
