/*
 * Where: Watch API model
 * What: Audit trail of one subscriber: delivered notifications and permanent failures
 * Why: Operators answer "was this subscriber told, when and how late" from one call
 */
package com.engagewatch.watch.api;

import com.engagewatch.watch.model.ChannelType;
import com.engagewatch.watch.model.DeliveryFailureRecord;
import com.engagewatch.watch.model.NotificationLogEntry;
import com.engagewatch.watch.model.ServiceTier;
import com.engagewatch.watch.service.NotificationHistory;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationLogResponse(
    String subscriberId, List<Entry> entries, List<Failure> failures) {

  static NotificationLogResponse from(String subscriberId, NotificationHistory history) {
    return new NotificationLogResponse(
        subscriberId,
        history.entries().stream().map(Entry::from).toList(),
        history.failures().stream().map(Failure::from).toList());
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Entry(
      UUID jobId,
      long resourceId,
      ChannelType channel,
      ServiceTier tier,
      long delaySeconds,
      Instant sentAt) {

    static Entry from(NotificationLogEntry entry) {
      return new Entry(
          entry.jobId(),
          entry.resourceId(),
          entry.channel(),
          entry.tier(),
          entry.delaySeconds(),
          entry.sentAt());
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Failure(
      UUID jobId,
      long resourceId,
      ServiceTier tier,
      int attemptCount,
      String errorMessage,
      Instant failedAt) {

    static Failure from(DeliveryFailureRecord record) {
      return new Failure(
          record.jobId(),
          record.resourceId(),
          record.tier(),
          record.attemptCount(),
          record.errorMessage(),
          record.createdAt());
    }
  }
}
