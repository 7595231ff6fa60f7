/*
 * Where: Watch service layer
 * What: Records poll, fan-out and delivery metrics
 * Why: Detection latency and delivery delay per tier are the numbers the service is judged on
 */
package com.engagewatch.watch.service;

import com.engagewatch.watch.model.ChannelType;
import com.engagewatch.watch.model.CheckOutcome;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class WatchMetrics {

  private static final String METRIC_POLL_CHECKS = "watch.poll.checks.total";
  private static final String METRIC_FETCH_LATENCY = "watch.fetch.latency";
  private static final String METRIC_CLASSIFICATION_ANOMALY = "watch.classification.anomaly.total";
  private static final String METRIC_OPENINGS = "watch.openings.total";
  private static final String METRIC_JOBS_ENQUEUED = "watch.fanout.jobs.enqueued.total";
  private static final String METRIC_DELIVERY_TOTAL = "watch.delivery.total";
  private static final String METRIC_DELIVERY_DELAY = "watch.delivery.delay";
  private static final String METRIC_DELIVERY_FAILED = "watch.delivery.failed.total";
  private static final String METRIC_BACKLOG = "watch.delay_queue.backlog";
  private static final String METRIC_WORKER_HALTED = "watch.worker.halted";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger backlog = new AtomicInteger(0);
  private final AtomicInteger haltedWorkers = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter classificationAnomalyCounter;
  private final Counter openingsCounter;
  private final Counter jobsEnqueuedCounter;
  private final Counter deliveryFailedCounter;
  private final Timer fetchLatencyTimer;

  public WatchMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_BACKLOG, backlog, AtomicInteger::get)
        .description("Delay jobs that are due but not yet claimed")
        .register(meterRegistry);
    Gauge.builder(METRIC_WORKER_HALTED, haltedWorkers, AtomicInteger::get)
        .description("Workers halted because the store is unavailable")
        .register(meterRegistry);
    this.classificationAnomalyCounter =
        Counter.builder(METRIC_CLASSIFICATION_ANOMALY)
            .description("Readings whose status label was missing or unknown")
            .register(meterRegistry);
    this.openingsCounter =
        Counter.builder(METRIC_OPENINGS)
            .description("Detected closed to open transitions")
            .register(meterRegistry);
    this.jobsEnqueuedCounter =
        Counter.builder(METRIC_JOBS_ENQUEUED)
            .description("Delay jobs created by fan-out")
            .register(meterRegistry);
    this.deliveryFailedCounter =
        Counter.builder(METRIC_DELIVERY_FAILED)
            .description("Delay jobs that exhausted their attempts")
            .register(meterRegistry);
    this.fetchLatencyTimer =
        Timer.builder(METRIC_FETCH_LATENCY)
            .description("Latency of resource page fetches")
            .register(meterRegistry);
  }

  public void recordCheck(CheckOutcome outcome) {
    counter(METRIC_POLL_CHECKS, "Status check outcomes", Tags.of("outcome", outcome.metricValue()))
        .increment();
  }

  public void recordFetchLatency(Duration latency) {
    fetchLatencyTimer.record(latency);
  }

  public void recordClassificationAnomaly() {
    classificationAnomalyCounter.increment();
  }

  public void recordOpening() {
    openingsCounter.increment();
  }

  public void recordJobsEnqueued(int count) {
    if (count > 0) {
      jobsEnqueuedCounter.increment(count);
    }
  }

  public void recordDeliveryResult(ChannelType channel, String result) {
    counter(
            METRIC_DELIVERY_TOTAL,
            "Channel delivery outcomes",
            Tags.of("channel", channel.name().toLowerCase(Locale.ROOT), "result", result))
        .increment();
  }

  /** Delay from the opening to the first successful delivery, tagged by tier. */
  public void recordDeliveryDelay(String tier, Instant openedAt, Instant sentAt) {
    if (openedAt == null || sentAt == null || sentAt.isBefore(openedAt)) {
      return;
    }
    Timer.builder(METRIC_DELIVERY_DELAY)
        .description("Delay from opening detection to delivery")
        .tags(Tags.of("tier", tier.toLowerCase(Locale.ROOT)))
        .register(meterRegistry)
        .record(Duration.between(openedAt, sentAt));
  }

  public void recordDeliveryFailed() {
    deliveryFailedCounter.increment();
  }

  public void updateBacklog(int dueJobs) {
    backlog.set(Math.max(dueJobs, 0));
  }

  public void updateHaltedWorkers(int count) {
    haltedWorkers.set(Math.max(count, 0));
  }

  private Counter counter(String name, String description, Tags tags) {
    final StringBuilder key = new StringBuilder(name);
    tags.forEach(tag -> key.append('|').append(tag.getKey()).append('=').append(tag.getValue()));
    return counters.computeIfAbsent(
        key.toString(),
        ignored ->
            Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
