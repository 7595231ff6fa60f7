/*
 * Where: Watch configuration binding
 * What: Opening-event fan-out worker settings
 * Why: Keep claim size and lease tunable without a rebuild
 */
package com.engagewatch.watch.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "watch.fanout")
@Validated
public record FanOutProperties(
    boolean enabled,
    @NotNull Duration pollInterval,
    @Positive int batchSize,
    @NotNull Duration lease) {

  @AssertTrue(message = "watch.fanout.lease must be positive")
  public boolean isLeasePositive() {
    return DurationChecks.isPositive(lease);
  }
}
