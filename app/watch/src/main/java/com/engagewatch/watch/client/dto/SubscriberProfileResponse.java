package com.engagewatch.watch.client.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubscriberProfileResponse(
    String subscriberId,
    String tier,
    String pushPlayerId,
    Boolean pushEnabled,
    String email,
    Boolean emailEnabled,
    String chatId) {}
