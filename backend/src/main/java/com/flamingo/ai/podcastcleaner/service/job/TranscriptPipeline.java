package com.flamingo.ai.podcastcleaner.service.job;

import com.flamingo.ai.podcastcleaner.domain.Job;
import com.flamingo.ai.podcastcleaner.domain.TranscriptResult;
import com.flamingo.ai.podcastcleaner.domain.VideoInfo;
import com.flamingo.ai.podcastcleaner.exception.CacheWriteException;
import com.flamingo.ai.podcastcleaner.exception.PipelineStageException;
import com.flamingo.ai.podcastcleaner.service.assembly.DocumentAssembler;
import com.flamingo.ai.podcastcleaner.service.cache.ResultCache;
import com.flamingo.ai.podcastcleaner.service.cleaning.TranscriptCleaningService;
import com.flamingo.ai.podcastcleaner.service.highlight.HighlightService;
import com.flamingo.ai.podcastcleaner.service.metadata.VideoMetadataService;
import com.flamingo.ai.podcastcleaner.service.transcript.TranscriptExtractor;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs the stages for one job: metadata, transcript, cleaning, takeaways, assembly, caching.
 *
 * <p>The result is cached and flushed before the job is marked completed, and the video's
 * in-flight slot is released last, so a concurrent submission either sees the slot or the cached
 * result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TranscriptPipeline {

  static final String STAGE_METADATA = "Getting video info...";
  static final String STAGE_TRANSCRIPT = "Extracting transcript...";
  static final String STAGE_CLEANING = "Cleaning transcript with Gemini...";
  static final String STAGE_HIGHLIGHTS = "Generating takeaways...";
  static final String STAGE_ASSEMBLY = "Assembling document...";
  static final String STAGE_SAVING = "Saving result...";

  private final VideoMetadataService videoMetadataService;
  private final TranscriptExtractor transcriptExtractor;
  private final TranscriptCleaningService transcriptCleaningService;
  private final HighlightService highlightService;
  private final DocumentAssembler documentAssembler;
  private final ResultCache resultCache;
  private final JobRegistry jobRegistry;
  private final MeterRegistry meterRegistry;

  /** Runs the pipeline on the pipeline executor. */
  @Async("pipelineExecutor")
  @Timed(value = "transcript.pipeline", description = "Time to process one video end to end")
  public void runAsync(Job job) {
    run(job);
  }

  public void run(Job job) {
    String videoId = job.getVideoId();
    log.info("Pipeline started: job={}, video={}", job.getId(), videoId);
    try {
      TranscriptResult result = process(job);

      job.updateProgress(STAGE_SAVING);
      resultCache.put(videoId, result);
      job.complete(result);

      meterRegistry.counter("transcript_jobs_total", "outcome", "completed").increment();
      log.info(
          "Pipeline completed: job={}, video={}, file={}",
          job.getId(),
          videoId,
          result.filename());
    } catch (PipelineStageException e) {
      job.fail(e.getMessage());
      meterRegistry
          .counter("transcript_jobs_total", "outcome", "failed", "stage", e.getStage())
          .increment();
      log.warn(
          "Pipeline failed at {} stage: job={}, video={}: {}",
          e.getStage(),
          job.getId(),
          videoId,
          e.getMessage());
    } catch (CacheWriteException e) {
      job.fail(e.getMessage());
      meterRegistry
          .counter("transcript_jobs_total", "outcome", "failed", "stage", "cache")
          .increment();
      log.error("Failed to cache result: job={}, video={}", job.getId(), videoId, e);
    } catch (RuntimeException e) {
      job.fail("Unexpected error: " + e.getMessage());
      meterRegistry
          .counter("transcript_jobs_total", "outcome", "failed", "stage", "unknown")
          .increment();
      log.error("Pipeline crashed: job={}, video={}", job.getId(), videoId, e);
    } finally {
      jobRegistry.releaseInFlight(job);
    }
  }

  private TranscriptResult process(Job job) {
    String videoId = job.getVideoId();

    job.updateProgress(STAGE_METADATA);
    VideoInfo videoInfo = videoMetadataService.fetchVideoInfo(videoId);
    log.debug("Video {} title: {}", videoId, videoInfo.title());

    job.updateProgress(STAGE_TRANSCRIPT);
    String rawTranscript = transcriptExtractor.extractTranscript(videoId, job.getSourceUrl());

    job.updateProgress(STAGE_CLEANING);
    String cleaned =
        transcriptCleaningService.cleanTranscript(videoId, videoInfo.title(), rawTranscript);

    job.updateProgress(STAGE_HIGHLIGHTS);
    String highlights = highlightService.generateHighlights(videoId, videoInfo.title(), cleaned);

    job.updateProgress(STAGE_ASSEMBLY);
    return documentAssembler.assemble(videoInfo, job.getSourceUrl(), highlights, cleaned);
  }
}
