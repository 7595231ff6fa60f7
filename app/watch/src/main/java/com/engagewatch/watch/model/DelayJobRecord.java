/*
 * Where: Watch domain model
 * What: One scheduled delivery for a (subscriber, resource) pair
 * Why: Holds the tier-derived send time and the claim lease of the dispatcher
 */
package com.engagewatch.watch.model;

import java.time.Instant;
import java.util.UUID;

public record DelayJobRecord(
    UUID jobId,
    String subscriberId,
    long resourceId,
    ServiceTier tier,
    Instant openedAt,
    Instant sendAt,
    DelayJobStatus status,
    String lockedBy,
    Instant lockedAt,
    Instant leaseUntil,
    int attemptCount,
    Instant nextRetryAt,
    String lastError,
    Instant createdAt,
    Instant sentAt) {

  public static DelayJobRecord pending(
      String subscriberId,
      long resourceId,
      ServiceTier tier,
      Instant openedAt,
      Instant sendAt,
      Instant createdAt) {
    return new DelayJobRecord(
        UUID.randomUUID(),
        subscriberId,
        resourceId,
        tier,
        openedAt,
        sendAt,
        DelayJobStatus.PENDING,
        null,
        null,
        null,
        0,
        null,
        null,
        createdAt,
        null);
  }
}
