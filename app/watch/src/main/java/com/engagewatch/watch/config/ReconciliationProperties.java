/*
 * Where: Watch configuration binding
 * What: Startup and periodic reconciliation settings
 * Why: Recovery after a crash must not depend on the next opening
 */
package com.engagewatch.watch.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "watch.reconciliation")
public record ReconciliationProperties(
    boolean runOnStartup, boolean enabled, Duration interval, Duration staleClaimThreshold) {

  public ReconciliationProperties {
    interval = interval == null ? Duration.ofMinutes(5) : interval;
    staleClaimThreshold =
        staleClaimThreshold == null ? Duration.ofMinutes(5) : staleClaimThreshold;
  }
}
