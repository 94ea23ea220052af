package com.flamingo.ai.podcastcleaner.domain;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A tracked unit of pipeline work.
 *
 * <p>All state lives in one immutable {@link JobSnapshot} that is replaced atomically on every
 * transition, so {@link #snapshot()} never observes a half-written record. Transitions out of a
 * terminal state are ignored.
 */
public final class Job {

  public static final String STARTING = "Starting...";
  public static final String LOADED_FROM_CACHE = "Loaded from cache";

  private final AtomicReference<JobSnapshot> state;

  private Job(JobSnapshot initial) {
    this.state = new AtomicReference<>(initial);
  }

  /** Creates a job whose pipeline is about to start. */
  public static Job processing(String videoId, String sourceUrl) {
    Instant now = Instant.now();
    return new Job(
        new JobSnapshot(
            newId(),
            videoId,
            sourceUrl,
            JobStatus.PROCESSING,
            STARTING,
            null,
            null,
            now,
            now));
  }

  /** Creates a job that is already complete, for results served from the cache. */
  public static Job completedFromCache(String videoId, String sourceUrl, TranscriptResult result) {
    Instant now = Instant.now();
    return new Job(
        new JobSnapshot(
            newId(),
            videoId,
            sourceUrl,
            JobStatus.COMPLETED,
            LOADED_FROM_CACHE,
            result,
            null,
            now,
            now));
  }

  public String getId() {
    return state.get().jobId();
  }

  public String getVideoId() {
    return state.get().videoId();
  }

  public String getSourceUrl() {
    return state.get().sourceUrl();
  }

  public JobSnapshot snapshot() {
    return state.get();
  }

  public void updateProgress(String progress) {
    state.updateAndGet(
        current ->
            current.status().isTerminal()
                ? current
                : current.withProgress(progress, Instant.now()));
  }

  public void complete(TranscriptResult result) {
    completeWith(result, "Done");
  }

  /** Completes a job with a result another pipeline already cached. */
  public void completeFromCache(TranscriptResult result) {
    completeWith(result, LOADED_FROM_CACHE);
  }

  public void fail(String message) {
    state.updateAndGet(
        current ->
            current.status().isTerminal() ? current : current.failed(message, Instant.now()));
  }

  private void completeWith(TranscriptResult result, String progress) {
    state.updateAndGet(
        current ->
            current.status().isTerminal()
                ? current
                : current.completed(result, progress, Instant.now()));
  }

  private static String newId() {
    return UUID.randomUUID().toString();
  }
}
