package com.flamingo.ai.podcastcleaner.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for submitting a video. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranscribeRequest {

  @NotBlank(message = "URL is required")
  private String url;
}
