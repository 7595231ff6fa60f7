package com.engagewatch.watch.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.engagewatch.watch.model.ChannelType;
import com.engagewatch.watch.model.CheckOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class WatchMetricsTest {

  @Test
  void recordsPollFanOutAndDeliveryMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final WatchMetrics metrics = new WatchMetrics(registry);
    final Instant openedAt = Instant.parse("2026-03-01T09:00:00Z");

    metrics.recordCheck(CheckOutcome.OPENED);
    metrics.recordCheck(CheckOutcome.OPENED);
    metrics.recordCheck(CheckOutcome.SKIPPED_BUSY);
    metrics.recordFetchLatency(Duration.ofMillis(250));
    metrics.recordClassificationAnomaly();
    metrics.recordOpening();
    metrics.recordJobsEnqueued(3);
    metrics.recordDeliveryResult(ChannelType.EMAIL, "success");
    metrics.recordDeliveryDelay("PRO", openedAt, openedAt.plusSeconds(11));
    metrics.recordDeliveryFailed();
    metrics.updateBacklog(4);
    metrics.updateHaltedWorkers(1);

    assertThat(
            registry.get("watch.poll.checks.total").tag("outcome", "opened").counter().count())
        .isEqualTo(2.0d);
    assertThat(
            registry
                .get("watch.poll.checks.total")
                .tag("outcome", "skipped_busy")
                .counter()
                .count())
        .isEqualTo(1.0d);
    assertThat(registry.get("watch.fetch.latency").timer().count()).isEqualTo(1L);
    assertThat(registry.get("watch.classification.anomaly.total").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("watch.openings.total").counter().count()).isEqualTo(1.0d);
    assertThat(registry.get("watch.fanout.jobs.enqueued.total").counter().count())
        .isEqualTo(3.0d);
    assertThat(
            registry
                .get("watch.delivery.total")
                .tags("channel", "email", "result", "success")
                .counter()
                .count())
        .isEqualTo(1.0d);
    assertThat(registry.get("watch.delivery.delay").tag("tier", "pro").timer().count())
        .isEqualTo(1L);
    assertThat(registry.get("watch.delivery.failed.total").counter().count()).isEqualTo(1.0d);
    assertThat(registry.get("watch.delay_queue.backlog").gauge().value()).isEqualTo(4.0d);
    assertThat(registry.get("watch.worker.halted").gauge().value()).isEqualTo(1.0d);
  }

  @Test
  void deliveryDelayBeforeOpeningIsIgnored() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final WatchMetrics metrics = new WatchMetrics(registry);
    final Instant openedAt = Instant.parse("2026-03-01T09:00:00Z");

    metrics.recordDeliveryDelay("FREE", openedAt, openedAt.minusSeconds(1));

    assertThat(registry.find("watch.delivery.delay").timer()).isNull();
  }
}
