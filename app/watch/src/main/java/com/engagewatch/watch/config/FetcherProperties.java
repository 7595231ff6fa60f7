/*
 * Where: Watch configuration binding
 * What: Location and timeouts of the page-fetcher service
 * Why: A hung fetch must fail the attempt instead of holding a poll thread
 */
package com.engagewatch.watch.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "watch.fetcher")
public record FetcherProperties(
    String baseUrl, String statusPath, Duration connectTimeout, Duration readTimeout) {

  public FetcherProperties {
    baseUrl = baseUrl == null ? "http://fetcher:80" : baseUrl;
    statusPath =
        statusPath == null || statusPath.isBlank()
            ? "/v1/resources/{resourceId}/status"
            : statusPath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
  }
}
