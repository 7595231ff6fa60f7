package com.engagewatch.watch.client.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDate;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResourceStatusResponse(
    Long resourceId,
    Boolean restrictedActionAvailable,
    Boolean standardActionAvailable,
    String statusLabel,
    String name,
    String location,
    LocalDate startDate,
    LocalDate endDate) {}
