package com.flamingo.ai.podcastcleaner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the podcast transcript cleaning service. */
@SpringBootApplication
public class PodcastCleanerApplication {

  public static void main(String[] args) {
    SpringApplication.run(PodcastCleanerApplication.class, args);
  }
}
