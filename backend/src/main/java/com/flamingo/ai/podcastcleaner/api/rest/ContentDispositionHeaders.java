package com.flamingo.ai.podcastcleaner.api.rest;

import java.nio.charset.StandardCharsets;
import org.springframework.web.util.UriUtils;

/** Builds attachment headers that survive non-ASCII filenames. */
final class ContentDispositionHeaders {

  private ContentDispositionHeaders() {}

  /**
   * Returns {@code attachment; filename="<ascii>"; filename*=UTF-8''<encoded>}. The plain
   * {@code filename} keeps printable ASCII only and falls back to {@code fallback} when nothing is
   * left.
   */
  static String attachment(String filename, String fallback) {
    String asciiName = asciiOnly(filename);
    if (asciiName.isBlank() || isOnlyExtension(asciiName)) {
      asciiName = fallback;
    }
    String encoded = UriUtils.encode(filename, StandardCharsets.UTF_8);
    return "attachment; filename=\"" + asciiName + "\"; filename*=UTF-8''" + encoded;
  }

  private static String asciiOnly(String filename) {
    StringBuilder sb = new StringBuilder();
    filename
        .codePoints()
        .filter(cp -> cp >= 0x20 && cp < 0x7f && cp != '"' && cp != '\\')
        .forEach(sb::appendCodePoint);
    return sb.toString().strip();
  }

  private static boolean isOnlyExtension(String name) {
    return name.startsWith(".") && name.indexOf('.', 1) < 0;
  }
}
