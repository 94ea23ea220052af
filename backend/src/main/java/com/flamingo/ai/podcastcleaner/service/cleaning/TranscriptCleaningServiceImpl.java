package com.flamingo.ai.podcastcleaner.service.cleaning;

import com.flamingo.ai.podcastcleaner.agent.TranscriptCleaningAgent;
import com.flamingo.ai.podcastcleaner.exception.CleaningFailedException;
import com.flamingo.ai.podcastcleaner.exception.PipelineStageException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

/** Implementation of {@link TranscriptCleaningService} using the cleaning agent. */
@Service
@Slf4j
public class TranscriptCleaningServiceImpl implements TranscriptCleaningService {

  // Models sometimes wrap the whole answer in a ```markdown fence
  private static final Pattern FENCED =
      Pattern.compile("^```[a-zA-Z]*\\s*\\n(.*?)\\n?```\\s*$", Pattern.DOTALL);

  private final TranscriptCleaningAgent transcriptCleaningAgent;

  public TranscriptCleaningServiceImpl(@Lazy TranscriptCleaningAgent transcriptCleaningAgent) {
    this.transcriptCleaningAgent = transcriptCleaningAgent;
  }

  /**
   * Cleans the transcript. Model errors reach the circuit breaker unwrapped; the fallback turns
   * them, and an open breaker, into {@link CleaningFailedException}.
   */
  @Override
  @CircuitBreaker(name = "gemini", fallbackMethod = "cleanTranscriptFallback")
  @Timed(value = "transcript.cleaning", description = "Time to clean a transcript with the LLM")
  public String cleanTranscript(String videoId, String title, String rawTranscript) {
    if (rawTranscript == null || rawTranscript.isBlank()) {
      throw new CleaningFailedException(videoId, "Transcript is empty, nothing to clean");
    }

    log.debug("Cleaning transcript for video {} ({} chars)", videoId, rawTranscript.length());
    String cleaned = transcriptCleaningAgent.clean(title, rawTranscript);

    if (cleaned == null || cleaned.isBlank()) {
      throw new CleaningFailedException(videoId, "Language model returned an empty transcript");
    }
    String result = unwrapFence(cleaned.strip());
    log.debug("Cleaned transcript for video {}: {} chars", videoId, result.length());
    return result;
  }

  @SuppressWarnings("unused")
  private String cleanTranscriptFallback(
      String videoId, String title, String rawTranscript, Throwable t) {
    if (t instanceof PipelineStageException stageFailure) {
      throw stageFailure;
    }
    log.warn("Transcript cleaning failed for video {}: {}", videoId, t.getMessage());
    throw new CleaningFailedException(videoId, "Failed to clean transcript: " + t.getMessage(), t);
  }

  private String unwrapFence(String text) {
    Matcher matcher = FENCED.matcher(text);
    return matcher.matches() ? matcher.group(1).strip() : text;
  }
}
