package com.flamingo.ai.podcastcleaner.service.render.layout;

import com.flamingo.ai.podcastcleaner.config.RenderProperties;

/** Font sizes and line heights derived from a {@link LayoutConfig}. */
public record Typography(
    float baseSize,
    float heading1Size,
    float heading2Size,
    float heading3Size,
    float lineHeightMultiplier) {

  public static Typography of(LayoutConfig config, RenderProperties.Typography settings) {
    float scale = config.scale();
    return new Typography(
        Math.max(settings.getMinBaseSize(), settings.getBaseSize() * scale),
        Math.max(settings.getMinHeadingSize(), settings.getHeading1Size() * scale),
        Math.max(settings.getMinHeadingSize(), settings.getHeading2Size() * scale),
        Math.max(settings.getMinHeadingSize(), settings.getHeading3Size() * scale),
        settings.getLineHeightMultiplier());
  }

  public float headingSize(int level) {
    return switch (level) {
      case 1 -> heading1Size;
      case 2 -> heading2Size;
      default -> heading3Size;
    };
  }

  public float lineHeight(float fontSize) {
    return fontSize * lineHeightMultiplier;
  }

  public float baseLineHeight() {
    return lineHeight(baseSize);
  }

  /** Indent of bullet text, 1.5 em of the base size. */
  public float bulletIndent() {
    return baseSize * 1.5f;
  }
}
