package com.flamingo.ai.podcastcleaner.exception;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.podcastcleaner.domain.JobStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

  private SimpleMeterRegistry meterRegistry;
  private GlobalExceptionHandler handler;
  private MockHttpServletRequest request;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    handler = new GlobalExceptionHandler(meterRegistry);
    request = new MockHttpServletRequest("POST", "/transcribe");
  }

  @Test
  @DisplayName("should map an invalid reference to 400")
  void shouldReturnBadRequest_whenReferenceInvalid() {
    ResponseEntity<ApiError> response =
        handler.handleInvalidReference(new InvalidReferenceException("nope"), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().getCode()).isEqualTo(ApiError.INVALID_REFERENCE);
    assertThat(response.getBody().getMessage()).contains("Could not extract video ID");
    assertThat(response.getBody().getPath()).isEqualTo("/transcribe");
    assertThat(response.getBody().getErrorId()).hasSize(8);
    assertThat(
            meterRegistry.counter("api_errors_total", "error_type", "invalid_reference").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("should map an unknown job to 404")
  void shouldReturnNotFound_whenJobUnknown() {
    ResponseEntity<ApiError> response =
        handler.handleJobNotFound(new JobNotFoundException("abc"), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody().getCode()).isEqualTo(ApiError.JOB_NOT_FOUND);
  }

  @Test
  @DisplayName("should map an unfinished job to 400")
  void shouldReturnBadRequest_whenJobNotCompleted() {
    ResponseEntity<ApiError> response =
        handler.handleJobNotCompleted(
            new JobNotCompletedException("abc", JobStatus.PROCESSING), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().getMessage()).isEqualTo("Job not completed");
  }

  @Test
  @DisplayName("should map a duplicate submission to 409")
  void shouldReturnConflict_whenAlreadyInProgress() {
    ResponseEntity<ApiError> response =
        handler.handleAlreadyInProgress(
            new AlreadyInProgressException("dQw4w9WgXcQ", "job-1"), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(response.getBody().getCode()).isEqualTo(ApiError.JOB_IN_PROGRESS);
  }

  @Test
  @DisplayName("should map a missing API key to 500 with a clear message")
  void shouldReturnServerError_whenNotConfigured() {
    ResponseEntity<ApiError> response =
        handler.handleConfiguration(
            new ConfigurationException("GOOGLE_API_KEY not configured"), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().getMessage()).isEqualTo("GOOGLE_API_KEY not configured");
  }

  @Test
  @DisplayName("should hide internal details of unexpected errors")
  void shouldReturnGenericMessage_whenUnexpectedError() {
    ResponseEntity<ApiError> response =
        handler.handleGeneric(new IllegalStateException("secret detail"), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().getMessage()).doesNotContain("secret");
  }
}
