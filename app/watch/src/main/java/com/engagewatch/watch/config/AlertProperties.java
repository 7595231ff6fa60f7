/*
 * Where: Watch configuration binding
 * What: Operator alert destination and the repeated-failure threshold
 * Why: Operators are told through the admin chat when a worker keeps failing
 */
package com.engagewatch.watch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "watch.alerts")
public record AlertProperties(boolean enabled, String chatId, int failureThreshold) {

  public AlertProperties {
    if (failureThreshold < 0) {
      throw new IllegalArgumentException("watch.alerts.failure-threshold must not be negative");
    }
    failureThreshold = failureThreshold == 0 ? 3 : failureThreshold;
  }

  public boolean hasDestination() {
    return enabled && chatId != null && !chatId.isBlank();
  }
}
