package com.flamingo.ai.podcastcleaner.api.rest;

import com.flamingo.ai.podcastcleaner.api.dto.request.TranscribeRequest;
import com.flamingo.ai.podcastcleaner.api.dto.response.JobStatusResponse;
import com.flamingo.ai.podcastcleaner.api.dto.response.JobSubmissionResponse;
import com.flamingo.ai.podcastcleaner.domain.TranscriptResult;
import com.flamingo.ai.podcastcleaner.service.job.TranscriptJobService;
import com.flamingo.ai.podcastcleaner.service.render.DocumentRenderService;
import com.flamingo.ai.podcastcleaner.service.render.layout.LayoutConfig;
import jakarta.validation.Valid;
import java.nio.charset.StandardCharsets;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for submitting videos, polling jobs and downloading results. */
@RestController
@RequiredArgsConstructor
@Slf4j
public class TranscriptController {

  static final MediaType TEXT_MARKDOWN = new MediaType("text", "markdown", StandardCharsets.UTF_8);

  private final TranscriptJobService transcriptJobService;
  private final DocumentRenderService documentRenderService;

  /** Submits a video for processing. */
  @PostMapping(value = "/transcribe", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<JobSubmissionResponse> transcribe(
      @Valid @RequestBody TranscribeRequest request) {
    String jobId = transcriptJobService.submit(request.getUrl());
    return ResponseEntity.ok(new JobSubmissionResponse(jobId));
  }

  /** Gets the status of a job. */
  @GetMapping("/status/{jobId}")
  public ResponseEntity<JobStatusResponse> status(@PathVariable String jobId) {
    return ResponseEntity.ok(JobStatusResponse.fromSnapshot(transcriptJobService.status(jobId)));
  }

  /** Downloads the markdown document of a completed job. */
  @GetMapping("/download/{jobId}")
  public ResponseEntity<byte[]> downloadMarkdown(@PathVariable String jobId) {
    TranscriptResult result = transcriptJobService.result(jobId);
    return ResponseEntity.ok()
        .contentType(TEXT_MARKDOWN)
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDispositionHeaders.attachment(result.filename(), "transcript.md"))
        .body(result.markdown().getBytes(StandardCharsets.UTF_8));
  }

  /** Renders and downloads the PDF version of a completed job. */
  @GetMapping("/download/{jobId}/pdf")
  public ResponseEntity<byte[]> downloadPdf(
      @PathVariable String jobId,
      @RequestParam(value = "font", required = false) String font,
      @RequestParam(value = "zoom", required = false) String zoom) {
    TranscriptResult result = transcriptJobService.result(jobId);
    LayoutConfig layoutConfig = documentRenderService.layoutFor(font, zoom);
    log.debug(
        "Rendering PDF for job {} (font={}, zoom={}%)",
        jobId,
        layoutConfig.fontFamily().getDisplayName(),
        layoutConfig.zoomPercent());

    byte[] pdf = documentRenderService.render(result.markdown(), layoutConfig);
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_PDF)
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDispositionHeaders.attachment(result.pdfFilename(), "transcript.pdf"))
        .body(pdf);
  }
}
