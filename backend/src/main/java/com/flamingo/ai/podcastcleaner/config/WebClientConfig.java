package com.flamingo.ai.podcastcleaner.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/** Outbound HTTP clients for the oEmbed lookup and remote image downloads. */
@Configuration
public class WebClientConfig {

  @Bean(name = "metadataWebClient")
  public WebClient metadataWebClient(WebClient.Builder builder) {
    return builder
        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(256 * 1024))
        .build();
  }

  @Bean(name = "imageWebClient")
  public WebClient imageWebClient(WebClient.Builder builder, RenderProperties renderProperties) {
    int maxBytes = renderProperties.getImage().getMaxBytes();
    return builder
        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxBytes))
        .build();
  }
}
