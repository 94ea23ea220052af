package com.flamingo.ai.podcastcleaner.service.transcript;

/** Extracts the raw caption text of a video. */
public interface TranscriptExtractor {

  /**
   * Extracts the transcript of a video.
   *
   * @param videoId the resolved video ID, used for error reporting
   * @param sourceUrl the reference the user submitted
   * @return raw transcript text
   * @throws com.flamingo.ai.podcastcleaner.exception.TranscriptUnavailableException if no caption
   *     track exists or extraction fails
   */
  String extractTranscript(String videoId, String sourceUrl);
}
