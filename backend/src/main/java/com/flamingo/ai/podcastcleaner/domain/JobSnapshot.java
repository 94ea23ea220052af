package com.flamingo.ai.podcastcleaner.domain;

import java.time.Instant;

/** Immutable view of a job's state at one point in time. */
public record JobSnapshot(
    String jobId,
    String videoId,
    String sourceUrl,
    JobStatus status,
    String progress,
    TranscriptResult result,
    String error,
    Instant createdAt,
    Instant updatedAt) {

  JobSnapshot withProgress(String newProgress, Instant now) {
    return new JobSnapshot(
        jobId, videoId, sourceUrl, status, newProgress, result, error, createdAt, now);
  }

  JobSnapshot completed(TranscriptResult newResult, String newProgress, Instant now) {
    return new JobSnapshot(
        jobId,
        videoId,
        sourceUrl,
        JobStatus.COMPLETED,
        newProgress,
        newResult,
        null,
        createdAt,
        now);
  }

  JobSnapshot failed(String message, Instant now) {
    return new JobSnapshot(
        jobId, videoId, sourceUrl, JobStatus.ERROR, progress, null, message, createdAt, now);
  }
}
