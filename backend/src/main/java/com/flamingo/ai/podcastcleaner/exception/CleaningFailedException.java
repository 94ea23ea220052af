package com.flamingo.ai.podcastcleaner.exception;

/** Exception thrown when the language model fails to clean a transcript. */
public class CleaningFailedException extends PipelineStageException {

  public CleaningFailedException(String videoId, String message) {
    super(videoId, message);
  }

  public CleaningFailedException(String videoId, String message, Throwable cause) {
    super(videoId, message, cause);
  }

  @Override
  public String getStage() {
    return "cleaning";
  }
}
