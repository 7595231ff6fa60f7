package com.engagewatch.watch.service;

import com.engagewatch.watch.config.TierProperties;
import com.engagewatch.watch.model.ServiceTier;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Send time of a delivery: the opening plus the tier delay, never earlier than now. */
@Component
@RequiredArgsConstructor
public class TierDelayPolicy {

  private final TierProperties properties;

  public Instant sendAt(ServiceTier tier, Instant openedAt, Instant now) {
    final Instant scheduled = openedAt.plus(properties.delayOf(tier));
    return scheduled.isAfter(now) ? scheduled : now;
  }

  public ServiceTier defaultTier() {
    return properties.defaultTier();
  }
}
