package com.flamingo.ai.podcastcleaner.api.rest;

import com.flamingo.ai.podcastcleaner.service.job.TranscriptJobService;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final TranscriptJobService transcriptJobService;

  /** Returns service status with cache and job counts. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "podcast-cleaner");
    health.put("cachedResults", transcriptJobService.cachedResultCount());
    health.put("activeJobs", transcriptJobService.activeJobCount());
    return ResponseEntity.ok(health);
  }
}
