package com.flamingo.ai.podcastcleaner.exception;

/** Exception thrown when a video is submitted while its pipeline is already running. */
public class AlreadyInProgressException extends RuntimeException {

  private final String videoId;
  private final String runningJobId;

  public AlreadyInProgressException(String videoId, String runningJobId) {
    super(String.format("Video %s is already being processed by job %s", videoId, runningJobId));
    this.videoId = videoId;
    this.runningJobId = runningJobId;
  }

  public String getVideoId() {
    return videoId;
  }

  public String getRunningJobId() {
    return runningJobId;
  }
}
