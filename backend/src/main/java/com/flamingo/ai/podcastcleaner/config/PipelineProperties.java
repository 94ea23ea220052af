package com.flamingo.ai.podcastcleaner.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the transcript pipeline. */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Getter
@Setter
public class PipelineProperties {

  /**
   * What to do when a submission arrives for a video whose pipeline is already running: ATTACH
   * returns the running job, REJECT fails the submission.
   */
  private InFlightPolicy inFlightPolicy = InFlightPolicy.ATTACH;

  private Cache cache = new Cache();
  private Metadata metadata = new Metadata();
  private Transcript transcript = new Transcript();
  private Assembly assembly = new Assembly();
  private Executor executor = new Executor();

  /** Handling of duplicate submissions for an in-flight video. */
  public enum InFlightPolicy {
    ATTACH,
    REJECT
  }

  @Getter
  @Setter
  public static class Cache {
    /** JSON file holding completed results keyed by video ID. */
    private String file = "transcript_cache.json";
  }

  @Getter
  @Setter
  public static class Metadata {
    /** oEmbed endpoint; {@code {videoId}} is replaced with the resolved identifier. */
    private String oembedUrl =
        "https://www.youtube.com/oembed?url=https://www.youtube.com/watch?v={videoId}&format=json";

    private String fallbackTitle = "Unknown Title";
    private int timeoutMs = 10000;
  }

  @Getter
  @Setter
  public static class Transcript {
    private String ytdlpBin = "yt-dlp";
    private String subtitleLanguage = "en";
    private long timeoutSeconds = 300;

    /** Optional proxy URL handed to yt-dlp for egress routing. */
    private String proxy;
  }

  @Getter
  @Setter
  public static class Assembly {
    /** Thumbnail image URL; {@code {videoId}} is replaced with the resolved identifier. */
    private String thumbnailUrl = "https://img.youtube.com/vi/{videoId}/maxresdefault.jpg";

    private int maxFilenameLength = 100;
  }

  @Getter
  @Setter
  public static class Executor {
    private int corePoolSize = 2;
    private int maxPoolSize = 4;
    private int queueCapacity = 100;
  }
}
