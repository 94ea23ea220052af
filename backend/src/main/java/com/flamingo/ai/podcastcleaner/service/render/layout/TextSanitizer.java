package com.flamingo.ai.podcastcleaner.service.render.layout;

import java.util.function.IntPredicate;

/** Makes text safe to hand to a font that covers only part of Unicode. */
final class TextSanitizer {

  static final char REPLACEMENT = '?';

  private TextSanitizer() {}

  /**
   * Replaces code points the font cannot encode with {@code ?}. Tabs become spaces and other
   * control characters are dropped.
   */
  static String sanitize(String text, IntPredicate encodable) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder(text.length());
    text.codePoints()
        .forEach(
            cp -> {
              if (cp == '\t') {
                sb.append(' ');
              } else if (Character.isISOControl(cp)) {
                return;
              } else if (encodable.test(cp)) {
                sb.appendCodePoint(cp);
              } else {
                sb.append(REPLACEMENT);
              }
            });
    return sb.toString();
  }
}
