package com.engagewatch.watch.model;

import java.time.Instant;
import java.util.UUID;

/** Append-only record of one successful delivery on one channel. */
public record NotificationLogEntry(
    UUID logId,
    UUID jobId,
    String subscriberId,
    long resourceId,
    ChannelType channel,
    ServiceTier tier,
    long delaySeconds,
    Instant sentAt) {}
