package com.flamingo.ai.podcastcleaner.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(InvalidReferenceException.class)
  public ResponseEntity<ApiError> handleInvalidReference(
      InvalidReferenceException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_reference");
    String errorId = generateErrorId();
    log.warn("Invalid reference [{}]: {}", errorId, ex.getReference());

    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.INVALID_REFERENCE, ex.getMessage(), request);
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ApiError> handleJobNotFound(
      JobNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("job_not_found");
    String errorId = generateErrorId();
    log.warn("Job not found [{}]: {}", errorId, ex.getJobId());

    return build(HttpStatus.NOT_FOUND, errorId, ApiError.JOB_NOT_FOUND, "Job not found", request);
  }

  @ExceptionHandler(JobNotCompletedException.class)
  public ResponseEntity<ApiError> handleJobNotCompleted(
      JobNotCompletedException ex, HttpServletRequest request) {

    incrementErrorCounter("job_not_completed");
    String errorId = generateErrorId();
    log.warn(
        "Job not completed [{}]: job={}, status={}",
        errorId,
        ex.getJobId(),
        ex.getStatus().value());

    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.JOB_NOT_COMPLETED, "Job not completed", request);
  }

  @ExceptionHandler(AlreadyInProgressException.class)
  public ResponseEntity<ApiError> handleAlreadyInProgress(
      AlreadyInProgressException ex, HttpServletRequest request) {

    incrementErrorCounter("already_in_progress");
    String errorId = generateErrorId();
    log.warn(
        "Duplicate submission rejected [{}]: video={}, runningJob={}",
        errorId,
        ex.getVideoId(),
        ex.getRunningJobId());

    return build(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.JOB_IN_PROGRESS,
        "This video is already being processed",
        request);
  }

  @ExceptionHandler(ConfigurationException.class)
  public ResponseEntity<ApiError> handleConfiguration(
      ConfigurationException ex, HttpServletRequest request) {

    incrementErrorCounter("configuration_error");
    String errorId = generateErrorId();
    log.error("Configuration error [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.CONFIGURATION_ERROR,
        "GOOGLE_API_KEY not configured",
        request);
  }

  @ExceptionHandler(DocumentRenderException.class)
  public ResponseEntity<ApiError> handleDocumentRender(
      DocumentRenderException ex, HttpServletRequest request) {

    incrementErrorCounter("render_error");
    String errorId = generateErrorId();
    log.error("Render error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.RENDER_ERROR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadableBody(
      HttpMessageNotReadableException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Unreadable request body [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        "Request body is missing or malformed",
        request);
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ApiError> handleNoResource(
      NoResourceFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("not_found");
    String errorId = generateErrorId();
    log.debug("No resource [{}]: {}", errorId, request.getRequestURI());

    return build(HttpStatus.NOT_FOUND, errorId, ApiError.NOT_FOUND, "Not found", request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .contentType(MediaType.APPLICATION_JSON)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
