package com.engagewatch.watch.model;

import java.time.Instant;
import java.util.UUID;

public record DeliveryFailureRecord(
    UUID failureId,
    UUID jobId,
    String subscriberId,
    long resourceId,
    ServiceTier tier,
    int attemptCount,
    String errorMessage,
    Instant createdAt) {}
