package com.flamingo.ai.podcastcleaner.service.highlight;

/** Service for generating the top takeaways of a transcript. */
public interface HighlightService {

  /** Number of takeaways every document carries. */
  int HIGHLIGHT_COUNT = 5;

  /**
   * Generates exactly {@value #HIGHLIGHT_COUNT} single-sentence takeaways.
   *
   * @param videoId the video the transcript belongs to, for error reporting
   * @param title the video title
   * @param cleanedTranscript the cleaned transcript
   * @return markdown bullet list, one {@code - } line per takeaway
   * @throws com.flamingo.ai.podcastcleaner.exception.GenerationFailedException if the model call
   *     fails or yields fewer than five bullets
   */
  String generateHighlights(String videoId, String title, String cleanedTranscript);
}
