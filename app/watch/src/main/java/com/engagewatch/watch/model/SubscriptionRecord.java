package com.engagewatch.watch.model;

import java.time.Instant;

public record SubscriptionRecord(
    String subscriberId,
    long resourceId,
    boolean notified,
    Instant notifiedAt,
    Instant createdAt) {}
