/*
 * Where: Watch configuration binding
 * What: Status poller schedule, concurrency, lease and failure backoff
 * Why: Poll cadence and the external call ceiling differ per environment
 */
package com.engagewatch.watch.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "watch.poller")
@Validated
public record PollerProperties(
    boolean enabled,
    @NotNull Duration pollInterval,
    @Positive int batchSize,
    @Positive int maxConcurrency,
    @NotNull Duration checkInterval,
    @NotNull Duration lease,
    @NotNull Duration failureBackoffBase,
    @NotNull Duration failureBackoffMax) {

  @AssertTrue(message = "watch.poller.check-interval must be positive")
  public boolean isCheckIntervalPositive() {
    return DurationChecks.isPositive(checkInterval);
  }

  @AssertTrue(message = "watch.poller.lease must be positive")
  public boolean isLeasePositive() {
    return DurationChecks.isPositive(lease);
  }

  @AssertTrue(message = "watch.poller.failure-backoff-max must not be shorter than the base")
  public boolean isFailureBackoffRangeValid() {
    return DurationChecks.isPositive(failureBackoffBase)
        && failureBackoffMax != null
        && failureBackoffMax.compareTo(failureBackoffBase) >= 0;
  }
}
