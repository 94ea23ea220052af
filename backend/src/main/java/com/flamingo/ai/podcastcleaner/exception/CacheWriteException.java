package com.flamingo.ai.podcastcleaner.exception;

/** Exception thrown when the result cache cannot be written to disk. */
public class CacheWriteException extends RuntimeException {

  public CacheWriteException(String message, Throwable cause) {
    super(message, cause);
  }
}
