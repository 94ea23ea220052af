package com.flamingo.ai.podcastcleaner.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO carrying the ID of a submitted job. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobSubmissionResponse {

  @JsonProperty("job_id")
  private String jobId;
}
