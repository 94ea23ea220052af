package com.flamingo.ai.podcastcleaner.service.metadata;

import com.flamingo.ai.podcastcleaner.domain.VideoInfo;

/** Looks up the title of a video. */
public interface VideoMetadataService {

  /**
   * Fetches title and canonical ID for a video.
   *
   * @param videoId the resolved video ID
   * @return title and ID
   * @throws com.flamingo.ai.podcastcleaner.exception.MetadataUnavailableException if the lookup
   *     fails
   */
  VideoInfo fetchVideoInfo(String videoId);
}
