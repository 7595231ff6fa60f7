/*
 * Where: Watch domain model
 * What: Durable ResourceOpened event written with the open transition
 * Why: Fan-out survives a crash between detection and job creation
 */
package com.engagewatch.watch.model;

import java.time.Instant;
import java.util.UUID;

public record OpeningEventRecord(
    UUID eventId,
    long resourceId,
    OpeningEventStatus status,
    Instant openedAt,
    String lockedBy,
    Instant leaseUntil,
    int attemptCount,
    Instant createdAt,
    Instant completedAt) {}
