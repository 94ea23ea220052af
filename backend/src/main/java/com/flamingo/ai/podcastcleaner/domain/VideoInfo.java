package com.flamingo.ai.podcastcleaner.domain;

/** Title and canonical identifier of a video, as reported by the metadata lookup. */
public record VideoInfo(String title, String videoId) {}
