package com.flamingo.ai.podcastcleaner.service.job;

import com.flamingo.ai.podcastcleaner.domain.JobSnapshot;
import com.flamingo.ai.podcastcleaner.domain.TranscriptResult;

/** Service for submitting videos and tracking their transcript jobs. */
public interface TranscriptJobService {

  /**
   * Submits a video for processing. Returns without waiting for the pipeline.
   *
   * @param reference a video URL or bare video ID
   * @return the job ID to poll; an already completed job when the result is cached
   * @throws com.flamingo.ai.podcastcleaner.exception.InvalidReferenceException if no video ID can
   *     be extracted
   * @throws com.flamingo.ai.podcastcleaner.exception.ConfigurationException if the language model
   *     is not configured and the result is not cached
   * @throws com.flamingo.ai.podcastcleaner.exception.AlreadyInProgressException if the video is
   *     being processed and duplicates are rejected
   */
  String submit(String reference);

  /**
   * Gets the current state of a job.
   *
   * @throws com.flamingo.ai.podcastcleaner.exception.JobNotFoundException if the job is unknown
   */
  JobSnapshot status(String jobId);

  /**
   * Gets the result of a completed job.
   *
   * @throws com.flamingo.ai.podcastcleaner.exception.JobNotFoundException if the job is unknown
   * @throws com.flamingo.ai.podcastcleaner.exception.JobNotCompletedException if the job is still
   *     processing or has failed
   */
  TranscriptResult result(String jobId);

  /** Number of pipelines currently running. */
  int activeJobCount();

  /** Number of cached results. */
  int cachedResultCount();
}
