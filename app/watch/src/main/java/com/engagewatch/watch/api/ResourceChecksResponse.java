package com.engagewatch.watch.api;

import com.engagewatch.watch.model.ResourceCheckRecord;
import com.engagewatch.watch.model.ResourceStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResourceChecksResponse(long resourceId, List<Check> checks) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Check(
      Instant checkedAt,
      ResourceStatus statusBefore,
      ResourceStatus statusAfter,
      long responseTimeMs,
      boolean success,
      String errorReason) {

    static Check from(ResourceCheckRecord record) {
      return new Check(
          record.checkedAt(),
          record.statusBefore(),
          record.statusAfter(),
          record.responseTimeMs(),
          record.success(),
          record.errorReason());
    }
  }
}
