package com.flamingo.ai.podcastcleaner.exception;

/** Exception thrown when no video identifier can be extracted from a reference. */
public class InvalidReferenceException extends RuntimeException {

  private final String reference;

  public InvalidReferenceException(String reference) {
    super("Could not extract video ID from URL: " + reference);
    this.reference = reference;
  }

  public String getReference() {
    return reference;
  }
}
