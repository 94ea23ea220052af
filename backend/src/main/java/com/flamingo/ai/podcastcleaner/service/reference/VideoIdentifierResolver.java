package com.flamingo.ai.podcastcleaner.service.reference;

import com.flamingo.ai.podcastcleaner.exception.InvalidReferenceException;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Extracts the 11-character YouTube video ID from the reference shapes users paste: watch URLs,
 * {@code youtu.be} short links, embed URLs, legacy {@code /v/} URLs and bare IDs.
 *
 * <p>Patterns are tried in order and the first capture wins.
 */
@Component
public class VideoIdentifierResolver {

  private static final List<Pattern> PATTERNS =
      List.of(
          Pattern.compile("(?:v=|/v/|youtu\\.be/)([a-zA-Z0-9_-]{11})"),
          Pattern.compile("(?:embed/)([a-zA-Z0-9_-]{11})"),
          Pattern.compile("^([a-zA-Z0-9_-]{11})$"));

  /**
   * Resolves a reference to its canonical video ID.
   *
   * @param reference user-supplied URL or ID
   * @return the video ID
   * @throws InvalidReferenceException if no pattern matches
   */
  public String resolve(String reference) {
    if (reference == null || reference.isBlank()) {
      throw new InvalidReferenceException(reference);
    }
    String trimmed = reference.strip();
    for (Pattern pattern : PATTERNS) {
      Matcher matcher = pattern.matcher(trimmed);
      if (matcher.find()) {
        return matcher.group(1);
      }
    }
    throw new InvalidReferenceException(reference);
  }
}
