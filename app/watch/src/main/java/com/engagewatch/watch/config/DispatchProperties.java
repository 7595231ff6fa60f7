/*
 * Where: Watch configuration binding
 * What: Delay queue claim, retry and backoff settings of the dispatcher
 * Why: Operators tune retry pressure on channel providers per environment
 */
package com.engagewatch.watch.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "watch.dispatch")
@Validated
public record DispatchProperties(
    boolean enabled,
    @NotNull Duration pollInterval,
    @Positive int batchSize,
    @Positive int maxConcurrency,
    @Positive int maxAttempts,
    @NotNull Duration backoffBase,
    @NotNull Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    @NotNull Duration backoffMin,
    @Positive int errorMessageMaxLength,
    @NotNull Duration lease) {

  @AssertTrue(message = "watch.dispatch.lease must be positive")
  public boolean isLeasePositive() {
    return DurationChecks.isPositive(lease);
  }

  @AssertTrue(message = "watch.dispatch.backoff-jitter-min must not exceed backoff-jitter-max")
  public boolean isJitterRangeValid() {
    return backoffJitterMin > 0 && backoffJitterMin <= backoffJitterMax;
  }
}
