/*
 * Where: Watch domain model
 * What: Row of the resources table
 * Why: Carries status, the immutable opening time and poll scheduling columns
 */
package com.engagewatch.watch.model;

import java.time.Instant;
import java.time.LocalDate;

public record ResourceRecord(
    long resourceId,
    String displayName,
    String location,
    LocalDate startDate,
    LocalDate endDate,
    ResourceStatus status,
    boolean open,
    Instant openedAt,
    Instant lastCheckedAt,
    Instant nextCheckAt,
    int consecutiveFailures,
    String pollLockedBy,
    Instant pollLeaseUntil,
    Instant createdAt,
    Instant updatedAt) {}
