package com.flamingo.ai.podcastcleaner.service.job;

import com.flamingo.ai.podcastcleaner.config.GeminiProperties;
import com.flamingo.ai.podcastcleaner.config.PipelineProperties;
import com.flamingo.ai.podcastcleaner.config.PipelineProperties.InFlightPolicy;
import com.flamingo.ai.podcastcleaner.domain.Job;
import com.flamingo.ai.podcastcleaner.domain.JobSnapshot;
import com.flamingo.ai.podcastcleaner.domain.JobStatus;
import com.flamingo.ai.podcastcleaner.domain.TranscriptResult;
import com.flamingo.ai.podcastcleaner.exception.AlreadyInProgressException;
import com.flamingo.ai.podcastcleaner.exception.ConfigurationException;
import com.flamingo.ai.podcastcleaner.exception.JobNotCompletedException;
import com.flamingo.ai.podcastcleaner.exception.JobNotFoundException;
import com.flamingo.ai.podcastcleaner.service.cache.ResultCache;
import com.flamingo.ai.podcastcleaner.service.reference.VideoIdentifierResolver;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/** Implementation of {@link TranscriptJobService}. */
@Service
@Slf4j
public class TranscriptJobServiceImpl implements TranscriptJobService {

  private final VideoIdentifierResolver videoIdentifierResolver;
  private final ResultCache resultCache;
  private final JobRegistry jobRegistry;
  private final TranscriptPipeline transcriptPipeline;
  private final GeminiProperties geminiProperties;
  private final PipelineProperties pipelineProperties;
  private final MeterRegistry meterRegistry;

  public TranscriptJobServiceImpl(
      VideoIdentifierResolver videoIdentifierResolver,
      ResultCache resultCache,
      JobRegistry jobRegistry,
      TranscriptPipeline transcriptPipeline,
      GeminiProperties geminiProperties,
      PipelineProperties pipelineProperties,
      MeterRegistry meterRegistry) {
    this.videoIdentifierResolver = videoIdentifierResolver;
    this.resultCache = resultCache;
    this.jobRegistry = jobRegistry;
    this.transcriptPipeline = transcriptPipeline;
    this.geminiProperties = geminiProperties;
    this.pipelineProperties = pipelineProperties;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public String submit(String reference) {
    String videoId = videoIdentifierResolver.resolve(reference);
    meterRegistry.counter("transcript_submissions_total").increment();

    Optional<TranscriptResult> cached = resultCache.get(videoId);
    if (cached.isPresent()) {
      return registerCachedJob(videoId, reference, cached.get());
    }

    if (!geminiProperties.hasApiKey()) {
      throw new ConfigurationException("GOOGLE_API_KEY not configured");
    }

    Job job = Job.processing(videoId, reference);
    // Registered before claiming so an attaching caller can always find the job it is handed
    jobRegistry.register(job);

    Optional<Job> running = jobRegistry.claimInFlight(job);
    if (running.isPresent()) {
      jobRegistry.unregister(job);
      return handleInFlight(videoId, running.get());
    }

    // The previous pipeline may have cached the result and released the slot after our lookup
    Optional<TranscriptResult> cachedMeanwhile = resultCache.get(videoId);
    if (cachedMeanwhile.isPresent()) {
      job.completeFromCache(cachedMeanwhile.get());
      jobRegistry.releaseInFlight(job);
      meterRegistry.counter("transcript_cache_hits_total").increment();
      log.info("Video {} was cached while submitting, job {} completed", videoId, job.getId());
      return job.getId();
    }

    log.info("Job {} created for video {}", job.getId(), videoId);
    try {
      transcriptPipeline.runAsync(job);
    } catch (TaskRejectedException e) {
      job.fail("Server is busy, please try again later");
      jobRegistry.releaseInFlight(job);
      meterRegistry
          .counter("transcript_jobs_total", "outcome", "failed", "stage", "rejected")
          .increment();
      log.error("Pipeline executor rejected job {} for video {}", job.getId(), videoId, e);
    }
    return job.getId();
  }

  @Override
  public JobSnapshot status(String jobId) {
    return findJob(jobId).snapshot();
  }

  @Override
  public TranscriptResult result(String jobId) {
    JobSnapshot snapshot = findJob(jobId).snapshot();
    if (snapshot.status() != JobStatus.COMPLETED || snapshot.result() == null) {
      throw new JobNotCompletedException(jobId, snapshot.status());
    }
    return snapshot.result();
  }

  @Override
  public int activeJobCount() {
    return jobRegistry.activeCount();
  }

  @Override
  public int cachedResultCount() {
    return resultCache.size();
  }

  private String registerCachedJob(String videoId, String reference, TranscriptResult result) {
    Job job = Job.completedFromCache(videoId, reference, result);
    jobRegistry.register(job);
    meterRegistry.counter("transcript_cache_hits_total").increment();
    log.info("Cache hit for video {}, job {} completed immediately", videoId, job.getId());
    return job.getId();
  }

  private String handleInFlight(String videoId, Job running) {
    if (pipelineProperties.getInFlightPolicy() == InFlightPolicy.REJECT) {
      throw new AlreadyInProgressException(videoId, running.getId());
    }
    log.info("Video {} already in progress, attaching to job {}", videoId, running.getId());
    return running.getId();
  }

  private Job findJob(String jobId) {
    return jobRegistry.find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }
}
