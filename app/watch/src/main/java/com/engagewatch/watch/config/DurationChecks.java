package com.engagewatch.watch.config;

import java.time.Duration;

final class DurationChecks {

  private DurationChecks() {}

  // null is reported by @NotNull
  static boolean isPositive(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
