package com.engagewatch.watch.channel;

import com.engagewatch.watch.model.ResourceStatus;
import com.engagewatch.watch.model.ServiceTier;
import com.engagewatch.watch.model.SubscriberProfile;
import java.time.Instant;
import java.util.UUID;

public record DeliveryRequest(
    UUID jobId,
    SubscriberProfile profile,
    long resourceId,
    String resourceName,
    ResourceStatus status,
    ServiceTier tier,
    Instant openedAt) {}
