package com.engagewatch.watch.api;

import com.engagewatch.watch.model.ResourceRecord;
import com.engagewatch.watch.model.ResourceStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.time.LocalDate;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResourceStatusResponse(
    long resourceId,
    ResourceStatus status,
    @JsonProperty("is_open") boolean open,
    Instant lastCheckedAt,
    Instant openedAt,
    String name,
    String location,
    LocalDate startDate,
    LocalDate endDate) {

  static ResourceStatusResponse from(ResourceRecord record) {
    return new ResourceStatusResponse(
        record.resourceId(),
        record.status(),
        record.open(),
        record.lastCheckedAt(),
        record.openedAt(),
        record.displayName(),
        record.location(),
        record.startDate(),
        record.endDate());
  }
}
