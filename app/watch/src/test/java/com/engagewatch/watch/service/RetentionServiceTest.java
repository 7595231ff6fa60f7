package com.engagewatch.watch.service;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.engagewatch.watch.config.RetentionProperties;
import com.engagewatch.watch.repository.DelayJobRepository;
import com.engagewatch.watch.repository.ResourceCheckRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RetentionServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-31T00:00:00Z");

  @Mock private ResourceCheckRepository resourceCheckRepository;
  @Mock private DelayJobRepository delayJobRepository;

  @Test
  void cleanupDeletesRowsOlderThanRetentionWindow() {
    final RetentionService service =
        new RetentionService(
            resourceCheckRepository,
            delayJobRepository,
            new RetentionProperties(true, 30, Duration.ofHours(1)),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
    final Instant threshold = Instant.parse("2026-03-01T00:00:00Z");
    when(delayJobRepository.countStaleActive(threshold)).thenReturn(1);

    service.cleanup();

    verify(resourceCheckRepository).deleteOlderThan(threshold);
    verify(delayJobRepository).deleteCancelledOlderThan(threshold);
  }
}
