package com.flamingo.ai.podcastcleaner.service.render;

import com.flamingo.ai.podcastcleaner.service.render.layout.LayoutConfig;

/** Service for rendering assembled markdown documents as PDF. */
public interface DocumentRenderService {

  /**
   * Builds a layout configuration from raw request values, using the configured page geometry.
   * Unknown fonts and invalid zoom values fall back to defaults.
   */
  LayoutConfig layoutFor(String font, String zoom);

  /**
   * Renders markdown to a PDF. Never fails because of document content; always produces at least
   * one page.
   *
   * @throws com.flamingo.ai.podcastcleaner.exception.DocumentRenderException if the PDF writer
   *     itself fails
   */
  byte[] render(String markdown, LayoutConfig layoutConfig);
}
