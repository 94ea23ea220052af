package com.flamingo.ai.podcastcleaner.service.job;

import com.flamingo.ai.podcastcleaner.domain.Job;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Table of all jobs plus the set of videos whose pipeline is currently running.
 *
 * <p>Jobs are never removed. A video holds at most one in-flight slot at a time.
 */
@Component
public class JobRegistry {

  private final Map<String, Job> jobs = new ConcurrentHashMap<>();
  private final Map<String, Job> inFlight = new ConcurrentHashMap<>();

  public void register(Job job) {
    jobs.put(job.getId(), job);
  }

  void unregister(Job job) {
    jobs.remove(job.getId(), job);
  }

  public Optional<Job> find(String jobId) {
    if (jobId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(jobs.get(jobId));
  }

  /**
   * Claims the in-flight slot for the job's video.
   *
   * @return the job already holding the slot, or empty when {@code job} now holds it
   */
  public Optional<Job> claimInFlight(Job job) {
    return Optional.ofNullable(inFlight.putIfAbsent(job.getVideoId(), job));
  }

  /** Releases the slot only if {@code job} still holds it. */
  public void releaseInFlight(Job job) {
    inFlight.remove(job.getVideoId(), job);
  }

  public Optional<Job> inFlightFor(String videoId) {
    return Optional.ofNullable(inFlight.get(videoId));
  }

  public int activeCount() {
    return inFlight.size();
  }

  public int size() {
    return jobs.size();
  }
}
