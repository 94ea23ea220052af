package com.flamingo.ai.podcastcleaner.exception;

/** Exception thrown when a required setting, such as the language model API key, is missing. */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }
}
