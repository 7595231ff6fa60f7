/*
 * Where: Watch fan-out unit tests
 * What: Tier-derived send times and idempotent job creation for one opening
 * Why: Each subscriber gets exactly one job scheduled on its own tier delay
 */
package com.engagewatch.watch.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.engagewatch.watch.client.SubscriberLookupException;
import com.engagewatch.watch.client.TierLookup;
import com.engagewatch.watch.config.TierProperties;
import com.engagewatch.watch.model.DelayJobRecord;
import com.engagewatch.watch.model.DelayJobStatus;
import com.engagewatch.watch.model.ServiceTier;
import com.engagewatch.watch.model.SubscriptionRecord;
import com.engagewatch.watch.repository.DelayJobRepository;
import com.engagewatch.watch.repository.SubscriptionRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FanOutCoordinatorTest {

  private static final long RESOURCE_ID = 77L;
  private static final Instant OPENED_AT = Instant.ofEpochSecond(1000);

  @Mock private SubscriptionRepository subscriptionRepository;
  @Mock private DelayJobRepository delayJobRepository;
  @Mock private TierLookup tierLookup;
  @Mock private WatchMetrics metrics;

  @Test
  void jobsAreScheduledOnEachSubscribersTierDelay() {
    final FanOutCoordinator coordinator = coordinatorAt(OPENED_AT);
    when(subscriptionRepository.findUnnotifiedByResource(RESOURCE_ID))
        .thenReturn(List.of(subscription("x"), subscription("y")));
    when(tierLookup.tierOf("x")).thenReturn(ServiceTier.PRO);
    when(tierLookup.tierOf("y")).thenReturn(ServiceTier.FREE);
    when(delayJobRepository.insertIfAbsent(any())).thenReturn(1);

    final int created = coordinator.handleOpened(RESOURCE_ID, OPENED_AT);

    assertThat(created).isEqualTo(2);
    final Map<String, DelayJobRecord> jobs = capturedJobs(2);
    assertThat(jobs.get("x").sendAt()).isEqualTo(Instant.ofEpochSecond(1010));
    assertThat(jobs.get("x").tier()).isEqualTo(ServiceTier.PRO);
    assertThat(jobs.get("y").sendAt()).isEqualTo(Instant.ofEpochSecond(1600));
    assertThat(jobs.get("y").status()).isEqualTo(DelayJobStatus.PENDING);
    assertThat(jobs.values()).allSatisfy(job -> assertThat(job.openedAt()).isEqualTo(OPENED_AT));
    verify(metrics).recordJobsEnqueued(2);
  }

  @Test
  void elapsedTierDelaySendsNow() {
    final Instant now = OPENED_AT.plusSeconds(900);
    final FanOutCoordinator coordinator = coordinatorAt(now);
    when(subscriptionRepository.findUnnotifiedByResource(RESOURCE_ID))
        .thenReturn(List.of(subscription("x"), subscription("y")));
    when(tierLookup.tierOf("x")).thenReturn(ServiceTier.PRO);
    when(tierLookup.tierOf("y")).thenReturn(ServiceTier.FREE);
    when(delayJobRepository.insertIfAbsent(any())).thenReturn(1);

    coordinator.handleOpened(RESOURCE_ID, OPENED_AT);

    final Map<String, DelayJobRecord> jobs = capturedJobs(2);
    assertThat(jobs.get("x").sendAt()).isEqualTo(now);
    assertThat(jobs.get("y").sendAt()).isEqualTo(now);
    assertThat(jobs.values())
        .allSatisfy(job -> assertThat(job.sendAt()).isAfterOrEqualTo(job.openedAt()));
  }

  @Test
  void tierLookupFailureFallsBackToDefaultTier() {
    final FanOutCoordinator coordinator = coordinatorAt(OPENED_AT);
    when(subscriptionRepository.findUnnotifiedByResource(RESOURCE_ID))
        .thenReturn(List.of(subscription("z")));
    when(tierLookup.tierOf("z"))
        .thenThrow(
            new SubscriberLookupException(SubscriberLookupException.Reason.TIMEOUT, "timeout"));
    when(delayJobRepository.insertIfAbsent(any())).thenReturn(1);

    coordinator.handleOpened(RESOURCE_ID, OPENED_AT);

    final DelayJobRecord job = capturedJobs(1).get("z");
    assertThat(job.tier()).isEqualTo(ServiceTier.FREE);
    assertThat(job.sendAt()).isEqualTo(Instant.ofEpochSecond(1600));
  }

  @Test
  void existingJobsAreNotCountedAsCreated() {
    final FanOutCoordinator coordinator = coordinatorAt(OPENED_AT);
    when(subscriptionRepository.findUnnotifiedByResource(RESOURCE_ID))
        .thenReturn(List.of(subscription("x"), subscription("y")));
    when(tierLookup.tierOf("x")).thenReturn(ServiceTier.PRO);
    when(tierLookup.tierOf("y")).thenReturn(ServiceTier.PREMIUM);
    when(delayJobRepository.insertIfAbsent(any())).thenReturn(0, 1);

    assertThat(coordinator.handleOpened(RESOURCE_ID, OPENED_AT)).isEqualTo(1);
    verify(metrics).recordJobsEnqueued(1);
  }

  @Test
  void noSubscribersCreatesNoJobs() {
    final FanOutCoordinator coordinator = coordinatorAt(OPENED_AT);
    when(subscriptionRepository.findUnnotifiedByResource(RESOURCE_ID)).thenReturn(List.of());

    assertThat(coordinator.handleOpened(RESOURCE_ID, OPENED_AT)).isZero();
    verify(delayJobRepository, times(0)).insertIfAbsent(any());
  }

  private FanOutCoordinator coordinatorAt(Instant now) {
    final TierDelayPolicy policy = new TierDelayPolicy(new TierProperties(null, null));
    return new FanOutCoordinator(
        subscriptionRepository,
        delayJobRepository,
        tierLookup,
        policy,
        metrics,
        Clock.fixed(now, ZoneOffset.UTC));
  }

  private Map<String, DelayJobRecord> capturedJobs(int expected) {
    final ArgumentCaptor<DelayJobRecord> captor = ArgumentCaptor.forClass(DelayJobRecord.class);
    verify(delayJobRepository, times(expected)).insertIfAbsent(captor.capture());
    return captor.getAllValues().stream()
        .collect(Collectors.toMap(DelayJobRecord::subscriberId, Function.identity()));
  }

  private static SubscriptionRecord subscription(String subscriberId) {
    return new SubscriptionRecord(subscriberId, RESOURCE_ID, false, null, OPENED_AT);
  }
}
