/*
 * Where: Watch configuration binding
 * What: Notification delay per service tier and the fallback tier
 * Why: Tier delays are a product decision, not code
 */
package com.engagewatch.watch.config;

import com.engagewatch.watch.model.ServiceTier;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "watch.tiers")
public record TierProperties(Map<ServiceTier, Duration> delays, ServiceTier defaultTier) {

  private static final Map<ServiceTier, Duration> DEFAULT_DELAYS =
      Map.of(
          ServiceTier.PRO, Duration.ofSeconds(10),
          ServiceTier.PREMIUM, Duration.ofSeconds(60),
          ServiceTier.FREE, Duration.ofSeconds(600));

  public TierProperties {
    final Map<ServiceTier, Duration> merged = new EnumMap<>(DEFAULT_DELAYS);
    if (delays != null) {
      delays.forEach(
          (tier, delay) -> {
            if (tier != null && delay != null) {
              if (delay.isNegative()) {
                throw new IllegalArgumentException(
                    "watch.tiers.delays." + tier + " must not be negative");
              }
              merged.put(tier, delay);
            }
          });
    }
    delays = Map.copyOf(merged);
    defaultTier = defaultTier == null ? ServiceTier.FREE : defaultTier;
  }

  public Duration delayOf(ServiceTier tier) {
    return delays.get(tier == null ? defaultTier : tier);
  }
}
