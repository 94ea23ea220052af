package com.flamingo.ai.podcastcleaner.exception;

/** Exception thrown when the language model fails to produce the five takeaways. */
public class GenerationFailedException extends PipelineStageException {

  public GenerationFailedException(String videoId, String message) {
    super(videoId, message);
  }

  public GenerationFailedException(String videoId, String message, Throwable cause) {
    super(videoId, message, cause);
  }

  @Override
  public String getStage() {
    return "highlights";
  }
}
