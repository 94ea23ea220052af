package com.flamingo.ai.podcastcleaner.api.dto.response;

import com.flamingo.ai.podcastcleaner.domain.TranscriptResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** The parts of a completed result shown to polling clients. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResultSummaryResponse {

  private String title;
  private String markdown;
  private String filename;

  public static ResultSummaryResponse fromResult(TranscriptResult result) {
    return ResultSummaryResponse.builder()
        .title(result.title())
        .markdown(result.markdown())
        .filename(result.filename())
        .build();
  }
}
