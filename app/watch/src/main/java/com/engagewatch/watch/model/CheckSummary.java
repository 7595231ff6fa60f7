package com.engagewatch.watch.model;

/** Aggregate of poll attempts; the average covers successful attempts only. */
public record CheckSummary(long totalChecks, long successfulChecks, double avgResponseTimeMs) {

  public static CheckSummary empty() {
    return new CheckSummary(0, 0, 0.0d);
  }

  /** Percentage of successful attempts, 0 when nothing was checked. */
  public double successRate() {
    return totalChecks == 0 ? 0.0d : successfulChecks * 100.0d / totalChecks;
  }
}
