package com.flamingo.ai.podcastcleaner.exception;

/** Exception thrown when the video metadata lookup fails. */
public class MetadataUnavailableException extends PipelineStageException {

  public MetadataUnavailableException(String videoId, String message) {
    super(videoId, message);
  }

  public MetadataUnavailableException(String videoId, String message, Throwable cause) {
    super(videoId, message, cause);
  }

  @Override
  public String getStage() {
    return "metadata";
  }
}
