package com.flamingo.ai.podcastcleaner.service.highlight;

import com.flamingo.ai.podcastcleaner.agent.HighlightAgent;
import com.flamingo.ai.podcastcleaner.exception.GenerationFailedException;
import com.flamingo.ai.podcastcleaner.exception.PipelineStageException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

/**
 * Implementation of {@link HighlightService} using the highlight agent.
 *
 * <p>The model's answer is normalized: any bullet style ({@code -}, {@code *}, {@code •} or a
 * numbered list) becomes a {@code - } line, surrounding prose is dropped, and only the first five
 * bullets are kept. Model errors and an open circuit breaker surface as {@link
 * GenerationFailedException} through the fallback.
 */
@Service
@Slf4j
public class HighlightServiceImpl implements HighlightService {

  private static final Pattern BULLET = Pattern.compile("^\\s*(?:[-*+•]|\\d+[.)])\\s+(.+)$");

  private final HighlightAgent highlightAgent;

  public HighlightServiceImpl(@Lazy HighlightAgent highlightAgent) {
    this.highlightAgent = highlightAgent;
  }

  @Override
  @CircuitBreaker(name = "gemini", fallbackMethod = "generateHighlightsFallback")
  @Timed(value = "transcript.highlights", description = "Time to generate takeaways")
  public String generateHighlights(String videoId, String title, String cleanedTranscript) {
    String answer = highlightAgent.extractTakeaways(title, cleanedTranscript);

    List<String> bullets = extractBullets(answer);
    if (bullets.size() < HIGHLIGHT_COUNT) {
      throw new GenerationFailedException(
          videoId,
          String.format(
              "Expected %d takeaways but the model returned %d", HIGHLIGHT_COUNT, bullets.size()));
    }
    if (bullets.size() > HIGHLIGHT_COUNT) {
      log.debug(
          "Model returned {} takeaways for video {}, keeping the first {}",
          bullets.size(),
          videoId,
          HIGHLIGHT_COUNT);
    }

    StringBuilder highlights = new StringBuilder();
    for (String bullet : bullets.subList(0, HIGHLIGHT_COUNT)) {
      highlights.append("- ").append(bullet).append('\n');
    }
    return highlights.toString().strip();
  }

  @SuppressWarnings("unused")
  private String generateHighlightsFallback(
      String videoId, String title, String cleanedTranscript, Throwable t) {
    if (t instanceof PipelineStageException stageFailure) {
      throw stageFailure;
    }
    log.warn("Takeaway generation failed for video {}: {}", videoId, t.getMessage());
    throw new GenerationFailedException(
        videoId, "Failed to generate takeaways: " + t.getMessage(), t);
  }

  List<String> extractBullets(String answer) {
    List<String> bullets = new ArrayList<>();
    if (answer == null) {
      return bullets;
    }
    for (String line : answer.split("\\R")) {
      Matcher matcher = BULLET.matcher(line);
      if (matcher.matches()) {
        String text = matcher.group(1).strip();
        if (!text.isEmpty()) {
          bullets.add(text);
        }
      }
    }
    return bullets;
  }
}
