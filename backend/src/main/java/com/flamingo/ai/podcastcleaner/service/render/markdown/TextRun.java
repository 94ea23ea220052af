package com.flamingo.ai.podcastcleaner.service.render.markdown;

/** A span of inline text drawn in one weight. */
public record TextRun(String text, boolean bold) {

  public static TextRun plain(String text) {
    return new TextRun(text, false);
  }

  public static TextRun bold(String text) {
    return new TextRun(text, true);
  }
}
