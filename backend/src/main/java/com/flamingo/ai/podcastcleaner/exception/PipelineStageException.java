package com.flamingo.ai.podcastcleaner.exception;

/**
 * Base class for failures of a single pipeline stage. The message is what the job reports to
 * polling clients.
 */
public abstract class PipelineStageException extends RuntimeException {

  private final String videoId;

  protected PipelineStageException(String videoId, String message) {
    super(message);
    this.videoId = videoId;
  }

  protected PipelineStageException(String videoId, String message, Throwable cause) {
    super(message, cause);
    this.videoId = videoId;
  }

  public String getVideoId() {
    return videoId;
  }

  /** Short stage name, used as a metrics tag. */
  public abstract String getStage();
}
