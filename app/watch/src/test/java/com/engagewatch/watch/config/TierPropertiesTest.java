package com.engagewatch.watch.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.engagewatch.watch.model.ServiceTier;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TierPropertiesTest {

  @Test
  void defaultsApplyWhenNothingIsConfigured() {
    final TierProperties properties = new TierProperties(null, null);

    assertThat(properties.delayOf(ServiceTier.PRO)).isEqualTo(Duration.ofSeconds(10));
    assertThat(properties.delayOf(ServiceTier.PREMIUM)).isEqualTo(Duration.ofSeconds(60));
    assertThat(properties.delayOf(ServiceTier.FREE)).isEqualTo(Duration.ofSeconds(600));
    assertThat(properties.defaultTier()).isEqualTo(ServiceTier.FREE);
  }

  @Test
  void configuredDelaysOverrideDefaultsPerTier() {
    final TierProperties properties =
        new TierProperties(Map.of(ServiceTier.PREMIUM, Duration.ZERO), ServiceTier.PRO);

    assertThat(properties.delayOf(ServiceTier.PREMIUM)).isEqualTo(Duration.ZERO);
    assertThat(properties.delayOf(ServiceTier.FREE)).isEqualTo(Duration.ofSeconds(600));
    assertThat(properties.delayOf(null)).isEqualTo(Duration.ofSeconds(10));
  }

  @Test
  void negativeDelayIsRejected() {
    assertThatThrownBy(
            () -> new TierProperties(Map.of(ServiceTier.PRO, Duration.ofSeconds(-1)), null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
