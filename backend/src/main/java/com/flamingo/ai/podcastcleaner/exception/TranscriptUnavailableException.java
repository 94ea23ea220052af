package com.flamingo.ai.podcastcleaner.exception;

/** Exception thrown when no caption track can be extracted for a video. */
public class TranscriptUnavailableException extends PipelineStageException {

  public TranscriptUnavailableException(String videoId, String message) {
    super(videoId, message);
  }

  public TranscriptUnavailableException(String videoId, String message, Throwable cause) {
    super(videoId, message, cause);
  }

  @Override
  public String getStage() {
    return "transcript";
  }
}
