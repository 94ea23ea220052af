package com.flamingo.ai.podcastcleaner.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.podcastcleaner.domain.JobSnapshot;
import com.flamingo.ai.podcastcleaner.domain.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for job status polling. Result and error are omitted when absent. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusResponse {

  private JobStatus status;
  private String progress;
  private ResultSummaryResponse result;
  private String error;

  public static JobStatusResponse fromSnapshot(JobSnapshot snapshot) {
    return JobStatusResponse.builder()
        .status(snapshot.status())
        .progress(snapshot.progress())
        .result(
            snapshot.status() == JobStatus.COMPLETED && snapshot.result() != null
                ? ResultSummaryResponse.fromResult(snapshot.result())
                : null)
        .error(snapshot.error())
        .build();
  }
}
