/*
 * Where: Watch end-to-end integration tests
 * What: Opening detection through fan-out to dispatch against a real database
 * Why: Exactly-once opening and per-pair delivery only hold when all the SQL works together
 */
package com.engagewatch.watch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.when;

import com.engagewatch.watch.channel.DeliveryRequest;
import com.engagewatch.watch.channel.NotificationChannel;
import com.engagewatch.watch.client.ResourceStatusFetcher;
import com.engagewatch.watch.client.SubscriberDirectory;
import com.engagewatch.watch.model.ChannelType;
import com.engagewatch.watch.model.CheckOutcome;
import com.engagewatch.watch.model.DelayJobRecord;
import com.engagewatch.watch.model.DelayJobStatus;
import com.engagewatch.watch.model.RawStatusReading;
import com.engagewatch.watch.model.ResourceMetadata;
import com.engagewatch.watch.model.ResourceStatus;
import com.engagewatch.watch.model.ServiceTier;
import com.engagewatch.watch.model.SubscriberProfile;
import com.engagewatch.watch.repository.DelayJobRepository;
import com.engagewatch.watch.repository.NotificationLogRepository;
import com.engagewatch.watch.repository.OpeningEventRepository;
import com.engagewatch.watch.repository.ResourceRepository;
import com.engagewatch.watch.repository.SubscriptionRepository;
import com.engagewatch.watch.repository.TableCleaner;
import com.engagewatch.watch.service.DispatchService;
import com.engagewatch.watch.service.FanOutService;
import com.engagewatch.watch.service.ReconciliationReport;
import com.engagewatch.watch.service.ReconciliationService;
import com.engagewatch.watch.service.RetentionService;
import com.engagewatch.watch.service.StatusPollService;
import com.engagewatch.watch.service.WatchService;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

@SpringBootTest
@ActiveProfiles("test")
class WatchFlowIntegrationTest extends AbstractPostgresContainerTest {

  private static final long RESOURCE_ID = 1001;

  @Autowired private WatchService watchService;
  @Autowired private StatusPollService statusPollService;
  @Autowired private FanOutService fanOutService;
  @Autowired private DispatchService dispatchService;
  @Autowired private ReconciliationService reconciliationService;
  @Autowired private RetentionService retentionService;
  @Autowired private ResourceRepository resourceRepository;
  @Autowired private SubscriptionRepository subscriptionRepository;
  @Autowired private OpeningEventRepository openingEventRepository;
  @Autowired private DelayJobRepository delayJobRepository;
  @Autowired private NotificationLogRepository notificationLogRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;
  @Autowired private RecordingChannel recordingChannel;

  @MockitoBean private ResourceStatusFetcher fetcher;
  @MockitoBean private SubscriberDirectory subscriberDirectory;

  @BeforeEach
  void setUp() {
    TableCleaner.deleteAll(jdbcTemplate);
    recordingChannel.deliveries.clear();
    stubSubscriber("sub-pro", ServiceTier.PRO);
    stubSubscriber("sub-free", ServiceTier.FREE);
    stubSubscriber("sub-late", ServiceTier.PREMIUM);
    when(fetcher.fetch(anyLong()))
        .thenReturn(
            new RawStatusReading(
                false,
                true,
                "Engagements ouverts",
                new ResourceMetadata("CSO Lamotte", "Lamotte-Beuvron", null, null)));
  }

  @Test
  void openingIsFannedOutOnTierScheduleAndDeliveredOnce() {
    watchService.subscribe("sub-pro", RESOURCE_ID);
    watchService.subscribe("sub-free", RESOURCE_ID);

    assertThat(statusPollService.checkOne(RESOURCE_ID)).isEqualTo(CheckOutcome.OPENED);
    assertThat(fanOutService.processPendingEvents()).isEqualTo(1);

    final DelayJobRecord proJob =
        delayJobRepository.findByPair("sub-pro", RESOURCE_ID).orElseThrow();
    final DelayJobRecord freeJob =
        delayJobRepository.findByPair("sub-free", RESOURCE_ID).orElseThrow();
    assertThat(Duration.between(proJob.openedAt(), proJob.sendAt()))
        .isEqualTo(Duration.ofSeconds(10));
    assertThat(Duration.between(freeJob.openedAt(), freeJob.sendAt()))
        .isEqualTo(Duration.ofSeconds(600));

    makeDue(proJob);
    assertThat(dispatchService.processDueBatch()).isEqualTo(1);
    assertThat(dispatchService.processDueBatch()).isZero();

    assertThat(recordingChannel.deliveries)
        .extracting(request -> request.profile().subscriberId())
        .containsExactly("sub-pro");
    assertThat(notificationLogRepository.findBySubscriber("sub-pro")).hasSize(1);
    assertThat(delayJobRepository.findById(proJob.jobId()))
        .map(DelayJobRecord::status)
        .contains(DelayJobStatus.SENT);
    assertThat(subscriptionRepository.find("sub-pro", RESOURCE_ID).orElseThrow().notified())
        .isTrue();
    assertThat(delayJobRepository.findById(freeJob.jobId()))
        .map(DelayJobRecord::status)
        .contains(DelayJobStatus.PENDING);
  }

  @Test
  void concurrentChecksRecordOneOpening() throws Exception {
    watchService.subscribe("sub-pro", RESOURCE_ID);
    final ExecutorService executor = Executors.newFixedThreadPool(2);
    final CountDownLatch start = new CountDownLatch(1);
    try {
      final List<Future<CheckOutcome>> outcomes = new ArrayList<>();
      for (int i = 0; i < 2; i++) {
        outcomes.add(
            executor.submit(
                () -> {
                  start.await();
                  return statusPollService.checkOne(RESOURCE_ID);
                }));
      }
      start.countDown();

      int opened = 0;
      for (Future<CheckOutcome> outcome : outcomes) {
        if (outcome.get(30, TimeUnit.SECONDS) == CheckOutcome.OPENED) {
          opened++;
        }
      }
      assertThat(opened).isEqualTo(1);
    } finally {
      executor.shutdownNow();
    }

    assertThat(countRows("opening_events")).isEqualTo(1);
    final Instant openedAt = resourceRepository.findById(RESOURCE_ID).orElseThrow().openedAt();
    assertThat(openingEventRepository.findByResourceId(RESOURCE_ID).orElseThrow().openedAt())
        .isEqualTo(openedAt);
  }

  @Test
  void reconciliationSchedulesSubscribersMissedByFanOut() {
    watchService.subscribe("sub-pro", RESOURCE_ID);
    // opened without an outbox event, as after a crash between detection and fan-out
    resourceRepository.markOpened(RESOURCE_ID, ResourceStatus.OPEN_STANDARD, Instant.now());

    final ReconciliationReport report = reconciliationService.reconcile();

    assertThat(report.resourcesRefanned()).isEqualTo(1);
    assertThat(report.jobsCreated()).isEqualTo(1);
    assertThat(delayJobRepository.findByPair("sub-pro", RESOURCE_ID)).isPresent();
    assertThat(reconciliationService.reconcile().isEmpty()).isTrue();
  }

  @Test
  void reconciliationAfterPartialFanOutAddsOnlyMissingJobs() {
    watchService.subscribe("sub-pro", RESOURCE_ID);
    watchService.subscribe("sub-free", RESOURCE_ID);
    watchService.subscribe("sub-late", RESOURCE_ID);
    final Instant openedAt = Instant.now();
    resourceRepository.markOpened(RESOURCE_ID, ResourceStatus.OPEN_STANDARD, openedAt);
    // the crash happened after the first subscriber was scheduled
    final DelayJobRecord existing =
        DelayJobRecord.pending(
            "sub-pro",
            RESOURCE_ID,
            ServiceTier.PRO,
            openedAt,
            openedAt.plusSeconds(10),
            openedAt);
    delayJobRepository.insertIfAbsent(existing);

    final ReconciliationReport report = reconciliationService.reconcile();

    assertThat(report.jobsCreated()).isEqualTo(2);
    assertThat(countRows("delay_jobs")).isEqualTo(3);
    assertThat(delayJobRepository.findByPair("sub-pro", RESOURCE_ID))
        .map(DelayJobRecord::jobId)
        .contains(existing.jobId());
    assertThat(delayJobRepository.findByPair("sub-free", RESOURCE_ID)).isPresent();
    assertThat(delayJobRepository.findByPair("sub-late", RESOURCE_ID)).isPresent();
    assertThat(reconciliationService.reconcile().isEmpty()).isTrue();
    assertThat(countRows("delay_jobs")).isEqualTo(3);
  }

  @Test
  void subscribeThenUnsubscribeBeforeOpeningLeavesNothingToDeliver() {
    assertThat(watchService.subscribe("sub-pro", RESOURCE_ID)).isTrue();
    assertThat(watchService.unsubscribe("sub-pro", RESOURCE_ID)).isTrue();

    assertThat(statusPollService.checkOne(RESOURCE_ID)).isEqualTo(CheckOutcome.OPENED);
    assertThat(fanOutService.processPendingEvents()).isEqualTo(1);

    assertThat(countRows("delay_jobs")).isZero();
    assertThat(dispatchService.processDueBatch()).isZero();
    assertThat(recordingChannel.deliveries).isEmpty();
    assertThat(subscriptionRepository.find("sub-pro", RESOURCE_ID)).isEmpty();
  }

  @Test
  void resubscribeAfterRetentionDoesNotDeliverTheSameOpeningAgain() {
    watchService.subscribe("sub-pro", RESOURCE_ID);
    statusPollService.checkOne(RESOURCE_ID);
    fanOutService.processPendingEvents();
    makeDue(delayJobRepository.findByPair("sub-pro", RESOURCE_ID).orElseThrow());
    assertThat(dispatchService.processDueBatch()).isEqualTo(1);
    jdbcTemplate.update(
        "UPDATE delay_jobs SET created_at = created_at - INTERVAL '90 days'",
        new MapSqlParameterSource());

    retentionService.cleanup();
    watchService.unsubscribe("sub-pro", RESOURCE_ID);
    watchService.subscribe("sub-pro", RESOURCE_ID);
    reconciliationService.reconcile();

    assertThat(dispatchService.processDueBatch()).isZero();
    assertThat(recordingChannel.deliveries).hasSize(1);
    assertThat(notificationLogRepository.findBySubscriber("sub-pro")).hasSize(1);
    assertThat(delayJobRepository.findByPair("sub-pro", RESOURCE_ID))
        .map(DelayJobRecord::status)
        .contains(DelayJobStatus.SENT);
  }

  @Test
  void lateSubscriberToOpenResourceIsScheduledImmediately() {
    watchService.subscribe("sub-pro", RESOURCE_ID);
    statusPollService.checkOne(RESOURCE_ID);
    fanOutService.processPendingEvents();

    watchService.subscribe("sub-late", RESOURCE_ID);

    final DelayJobRecord job =
        delayJobRepository.findByPair("sub-late", RESOURCE_ID).orElseThrow();
    assertThat(job.tier()).isEqualTo(ServiceTier.PREMIUM);
    assertThat(job.sendAt()).isAfterOrEqualTo(job.openedAt());
  }

  @Test
  void unsubscribeBeforeSendLeavesNothingToDeliver() {
    watchService.subscribe("sub-pro", RESOURCE_ID);
    statusPollService.checkOne(RESOURCE_ID);
    fanOutService.processPendingEvents();

    assertThat(watchService.unsubscribe("sub-pro", RESOURCE_ID)).isTrue();

    assertThat(delayJobRepository.findByPair("sub-pro", RESOURCE_ID)).isEmpty();
    assertThat(dispatchService.processDueBatch()).isZero();
    assertThat(recordingChannel.deliveries).isEmpty();
    assertThat(notificationLogRepository.findBySubscriber("sub-pro")).isEmpty();
  }

  private void stubSubscriber(String subscriberId, ServiceTier tier) {
    final SubscriberProfile profile =
        new SubscriberProfile(subscriberId, tier, null, false, null, false, "chat-" + subscriberId);
    when(subscriberDirectory.findProfile(subscriberId)).thenReturn(profile);
    when(subscriberDirectory.tierOf(subscriberId)).thenReturn(tier);
  }

  private void makeDue(DelayJobRecord job) {
    jdbcTemplate.update(
        "UPDATE delay_jobs SET send_at = opened_at WHERE job_id = :jobId",
        new MapSqlParameterSource().addValue("jobId", job.jobId()));
  }

  private int countRows(String table) {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM " + table, new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  @TestConfiguration
  static class ChannelTestConfiguration {

    @Bean
    RecordingChannel recordingChannel() {
      return new RecordingChannel();
    }
  }

  static class RecordingChannel implements NotificationChannel {

    final List<DeliveryRequest> deliveries = new CopyOnWriteArrayList<>();

    @Override
    public ChannelType type() {
      return ChannelType.CHAT_BOT;
    }

    @Override
    public void deliver(DeliveryRequest request) {
      deliveries.add(request);
    }
  }
}
