package com.flamingo.ai.podcastcleaner.exception;

/** Exception thrown when the PDF writer fails to produce a document. */
public class DocumentRenderException extends RuntimeException {

  private final String userMessage;

  public DocumentRenderException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Failed to render PDF document";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
