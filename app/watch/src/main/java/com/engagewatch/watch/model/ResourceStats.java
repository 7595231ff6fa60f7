package com.engagewatch.watch.model;

import java.time.Instant;

public record ResourceStats(
    long resourceId,
    ResourceStatus status,
    Instant openedAt,
    Instant lastCheckedAt,
    CheckSummary checks) {}
