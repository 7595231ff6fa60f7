package com.engagewatch.watch.api;

import com.engagewatch.watch.model.CheckSummary;
import com.engagewatch.watch.model.GlobalStats;
import com.engagewatch.watch.model.ResourceStats;
import com.engagewatch.watch.model.ResourceStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/** Read-only statistics payloads built from check history and opening events. */
public final class StatsResponse {

  private StatsResponse() {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Checks(
      long totalChecks, long successfulChecks, double successRate, double avgResponseTimeMs) {

    static Checks from(CheckSummary summary) {
      return new Checks(
          summary.totalChecks(),
          summary.successfulChecks(),
          round(summary.successRate()),
          round(summary.avgResponseTimeMs()));
    }

    private static double round(double value) {
      return Math.round(value * 100.0d) / 100.0d;
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Global(
      long trackedResources, long openResources, long openings, long checksToday, Checks checks) {

    static Global from(GlobalStats stats) {
      return new Global(
          stats.trackedResources(),
          stats.openResources(),
          stats.openings(),
          stats.checksToday(),
          Checks.from(stats.checks()));
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Resource(
      long resourceId,
      ResourceStatus status,
      Instant openedAt,
      Instant lastCheckedAt,
      Checks checks) {

    static Resource from(ResourceStats stats) {
      return new Resource(
          stats.resourceId(),
          stats.status(),
          stats.openedAt(),
          stats.lastCheckedAt(),
          Checks.from(stats.checks()));
    }
  }
}
