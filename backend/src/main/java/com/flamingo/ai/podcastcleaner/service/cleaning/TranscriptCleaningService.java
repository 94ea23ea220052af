package com.flamingo.ai.podcastcleaner.service.cleaning;

/** Service for turning raw captions into a readable, chaptered transcript using an LLM. */
public interface TranscriptCleaningService {

  /**
   * Cleans a raw transcript.
   *
   * @param videoId the video the transcript belongs to, for error reporting
   * @param title the video title (gives the model context for names)
   * @param rawTranscript caption text as extracted
   * @return cleaned markdown with {@code ###} chapter headings
   * @throws com.flamingo.ai.podcastcleaner.exception.CleaningFailedException if the model call
   *     fails or returns nothing
   */
  String cleanTranscript(String videoId, String title, String rawTranscript);
}
