package com.flamingo.ai.podcastcleaner.exception;

import com.flamingo.ai.podcastcleaner.domain.JobStatus;

/** Exception thrown when a result is requested from a job that has not completed. */
public class JobNotCompletedException extends RuntimeException {

  private final String jobId;
  private final JobStatus status;

  public JobNotCompletedException(String jobId, JobStatus status) {
    super(String.format("Job %s is not completed (status: %s)", jobId, status.value()));
    this.jobId = jobId;
    this.status = status;
  }

  public String getJobId() {
    return jobId;
  }

  public JobStatus getStatus() {
    return status;
  }
}
