package com.flamingo.ai.podcastcleaner.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Completed output of the transcript pipeline. Stored in the result cache with the JSON keys the
 * cache file has always used.
 */
public record TranscriptResult(
    @JsonProperty("title") String title,
    @JsonProperty("url") String sourceUrl,
    @JsonProperty("takeaways") String highlights,
    @JsonProperty("transcript") String transcript,
    @JsonProperty("markdown") String markdown,
    @JsonProperty("filename") String filename) {

  /** Filename for the PDF rendition of this result. */
  public String pdfFilename() {
    if (filename.endsWith(".md")) {
      return filename.substring(0, filename.length() - 3) + ".pdf";
    }
    return filename + ".pdf";
  }
}
