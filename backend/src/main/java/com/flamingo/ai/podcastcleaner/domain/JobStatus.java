package com.flamingo.ai.podcastcleaner.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Lifecycle state of a transcript job. */
public enum JobStatus {
  /** The pipeline is running. */
  PROCESSING,

  /** The result is available and has been written to the result cache. */
  COMPLETED,

  /** A pipeline stage failed; the job carries the error message. */
  ERROR;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean isTerminal() {
    return this != PROCESSING;
  }
}
