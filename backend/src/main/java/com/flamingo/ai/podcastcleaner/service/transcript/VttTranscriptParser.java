package com.flamingo.ai.podcastcleaner.service.transcript;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Turns a WebVTT subtitle file into running text.
 *
 * <p>Headers, timestamps and cue identifiers are dropped, inline tags are stripped, and repeated
 * lines are removed because auto-generated captions repeat each line as the caption window
 * scrolls.
 */
@Component
public class VttTranscriptParser {

  private static final Pattern TIMESTAMP_LINE = Pattern.compile("^\\d{2}:\\d{2}.*");
  private static final Pattern CUE_IDENTIFIER = Pattern.compile("^[\\d\\-:.\\s>]+$");
  private static final Pattern INLINE_TAG = Pattern.compile("<[^>]+>");

  public String parse(String vttContent) {
    if (vttContent == null) {
      return "";
    }
    Set<String> seen = new LinkedHashSet<>();
    List<String> textLines = new ArrayList<>();

    for (String rawLine : vttContent.split("\n")) {
      String line = rawLine.strip();
      if (line.isEmpty()
          || line.startsWith("WEBVTT")
          || line.startsWith("Kind:")
          || line.startsWith("Language:")
          || TIMESTAMP_LINE.matcher(line).matches()
          || CUE_IDENTIFIER.matcher(line).matches()) {
        continue;
      }

      String text = INLINE_TAG.matcher(line).replaceAll("").replace("&nbsp;", " ");
      if (seen.add(text)) {
        textLines.add(text);
      }
    }
    return String.join(" ", textLines);
  }
}
