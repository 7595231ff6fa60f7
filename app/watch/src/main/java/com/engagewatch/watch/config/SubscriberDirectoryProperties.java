/*
 * Where: Watch configuration binding
 * What: Account service location, timeouts and profile cache settings
 * Why: Tier and channel lookups are on the fan-out and dispatch paths
 */
package com.engagewatch.watch.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "watch.subscribers")
public record SubscriberDirectoryProperties(
    String baseUrl,
    String profilePath,
    Duration connectTimeout,
    Duration readTimeout,
    Duration cacheTtl,
    long cacheMaxSize) {

  public SubscriberDirectoryProperties {
    baseUrl = baseUrl == null ? "http://account:80" : baseUrl;
    profilePath =
        profilePath == null || profilePath.isBlank()
            ? "/v1/subscribers/{subscriberId}/profile"
            : profilePath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
    cacheTtl = cacheTtl == null ? Duration.ofSeconds(60) : cacheTtl;
    cacheMaxSize = cacheMaxSize <= 0 ? 10_000 : cacheMaxSize;
  }
}
