package com.flamingo.ai.podcastcleaner.service.render.layout;

/**
 * Caller-chosen options for one PDF rendering.
 *
 * @param fontFamily font from the allow-list
 * @param zoomPercent text scale, always within [{@value #MIN_ZOOM}, {@value #MAX_ZOOM}]
 * @param pageGeometry page size and margins
 */
public record LayoutConfig(FontFamily fontFamily, int zoomPercent, PageGeometry pageGeometry) {

  public static final int DEFAULT_ZOOM = 100;
  public static final int MIN_ZOOM = 50;
  public static final int MAX_ZOOM = 200;

  public LayoutConfig {
    fontFamily = fontFamily == null ? FontFamily.DEFAULT : fontFamily;
    zoomPercent = clampZoom(zoomPercent);
    pageGeometry = pageGeometry == null ? PageGeometry.LETTER : pageGeometry;
  }

  public static LayoutConfig defaults() {
    return new LayoutConfig(FontFamily.DEFAULT, DEFAULT_ZOOM, PageGeometry.LETTER);
  }

  /**
   * Builds a config from raw request values. Unknown fonts fall back to the default family and a
   * missing or non-numeric zoom falls back to {@value #DEFAULT_ZOOM}.
   */
  public static LayoutConfig of(String font, String zoom, PageGeometry pageGeometry) {
    return new LayoutConfig(FontFamily.fromName(font), parseZoom(zoom), pageGeometry);
  }

  public float scale() {
    return zoomPercent / 100f;
  }

  static int parseZoom(String zoom) {
    if (zoom == null || zoom.isBlank()) {
      return DEFAULT_ZOOM;
    }
    try {
      double value = Double.parseDouble(zoom.strip());
      if (Double.isNaN(value)) {
        return DEFAULT_ZOOM;
      }
      return clampZoom((int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value)));
    } catch (NumberFormatException e) {
      return DEFAULT_ZOOM;
    }
  }

  private static int clampZoom(int zoom) {
    return Math.max(MIN_ZOOM, Math.min(MAX_ZOOM, zoom));
  }
}
