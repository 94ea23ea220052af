package com.flamingo.ai.podcastcleaner.service.render.layout;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Drawing surface the layout engine paints on. Coordinates are PDF points with the origin at the
 * bottom left of the page; text is positioned by its baseline.
 */
public interface PageCanvas {

  /** Starts a new page; every later call draws on it. */
  void newPage() throws IOException;

  float textWidth(String text, float fontSize, boolean bold) throws IOException;

  boolean canEncode(int codePoint, boolean bold);

  void drawText(String text, float x, float baseline, float fontSize, boolean bold)
      throws IOException;

  /** Converts an image for {@link #drawImage}. Leaves the current page untouched. */
  CanvasImage prepareImage(BufferedImage image) throws IOException;

  void drawImage(CanvasImage image, float x, float y, float width, float height)
      throws IOException;

  void drawLine(float x1, float y1, float x2, float y2, float thickness) throws IOException;

  /** An image converted into the representation of one canvas. */
  interface CanvasImage {}
}
