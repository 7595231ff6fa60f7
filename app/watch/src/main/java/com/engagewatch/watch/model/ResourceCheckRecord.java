package com.engagewatch.watch.model;

import java.time.Instant;
import java.util.UUID;

public record ResourceCheckRecord(
    UUID checkId,
    long resourceId,
    Instant checkedAt,
    ResourceStatus statusBefore,
    ResourceStatus statusAfter,
    long responseTimeMs,
    boolean success,
    String errorReason) {}
