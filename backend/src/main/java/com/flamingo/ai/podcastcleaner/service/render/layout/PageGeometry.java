package com.flamingo.ai.podcastcleaner.service.render.layout;

import com.flamingo.ai.podcastcleaner.config.RenderProperties;

/** Page size and uniform margin in PDF points. */
public record PageGeometry(float width, float height, float margin) {

  /** US Letter with one inch margins. */
  public static final PageGeometry LETTER = new PageGeometry(612f, 792f, 72f);

  public PageGeometry {
    if (width <= 2 * margin || height <= 2 * margin || margin < 0) {
      throw new IllegalArgumentException(
          String.format("Invalid page geometry %.1fx%.1f margin %.1f", width, height, margin));
    }
  }

  public static PageGeometry from(RenderProperties.Page page) {
    return new PageGeometry(page.getWidth(), page.getHeight(), page.getMargin());
  }

  public float left() {
    return margin;
  }

  public float right() {
    return width - margin;
  }

  public float top() {
    return height - margin;
  }

  public float bottom() {
    return margin;
  }

  public float printableWidth() {
    return width - 2 * margin;
  }

  public float printableHeight() {
    return height - 2 * margin;
  }
}
