package com.flamingo.ai.podcastcleaner.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for PDF rendering of transcript documents. */
@Configuration
@ConfigurationProperties(prefix = "render")
@Getter
@Setter
public class RenderProperties {

  private Page page = new Page();
  private Typography typography = new Typography();
  private Image image = new Image();

  /** Page geometry in PDF points (1/72 inch). Defaults to US Letter with 1 inch margins. */
  @Getter
  @Setter
  public static class Page {
    private float width = 612f;
    private float height = 792f;
    private float margin = 72f;
  }

  /** Point sizes at 100% zoom. */
  @Getter
  @Setter
  public static class Typography {
    private float baseSize = 12f;
    private float heading1Size = 18f;
    private float heading2Size = 14f;
    private float heading3Size = 13f;
    private float minBaseSize = 6f;
    private float minHeadingSize = 8f;
    private float lineHeightMultiplier = 1.5f;
  }

  @Getter
  @Setter
  public static class Image {
    /** Largest image width as a fraction of the printable width. */
    private float maxWidthRatio = 0.6f;

    private int timeoutMs = 10000;
    private int maxBytes = 10 * 1024 * 1024; // 10 MB
  }
}
