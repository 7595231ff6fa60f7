/*
 * Where: DelayJobRepository integration tests
 * What: Pair uniqueness, exclusive claim, lease-conditional completion and recovery updates
 * Why: A subscriber must never receive two notifications for one opening
 */
package com.engagewatch.watch.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.engagewatch.watch.AbstractPostgresContainerTest;
import com.engagewatch.watch.model.DelayJobRecord;
import com.engagewatch.watch.model.DelayJobStatus;
import com.engagewatch.watch.model.ServiceTier;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class DelayJobRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant OPENED_AT = Instant.parse("2026-10-19T09:00:00Z");

  @Autowired private DelayJobRepository delayJobRepository;

  @Autowired private ResourceRepository resourceRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void setUp() {
    TableCleaner.deleteAll(jdbcTemplate);
    resourceRepository.insertIfAbsent(1001, OPENED_AT.minusSeconds(3600));
  }

  @Test
  void insertIfAbsentKeepsOneJobPerPair() {
    final int first = delayJobRepository.insertIfAbsent(job("sub-1", ServiceTier.PRO, 10));
    final int second = delayJobRepository.insertIfAbsent(job("sub-1", ServiceTier.FREE, 600));

    assertThat(first).isEqualTo(1);
    assertThat(second).isZero();
    assertThat(delayJobRepository.findByPair("sub-1", 1001))
        .map(DelayJobRecord::tier)
        .contains(ServiceTier.PRO);
  }

  @Test
  void sendAtBeforeOpeningIsRejected() {
    final DelayJobRecord invalid =
        DelayJobRecord.pending(
            "sub-1", 1001, ServiceTier.PRO, OPENED_AT, OPENED_AT.minusSeconds(1), OPENED_AT);

    assertThatThrownBy(() -> delayJobRepository.insertIfAbsent(invalid))
        .isInstanceOf(DataIntegrityViolationException.class);
  }

  @Test
  void claimDueReturnsOnlyDueJobsAndEachJobOnce() {
    delayJobRepository.insertIfAbsent(job("sub-pro", ServiceTier.PRO, 10));
    delayJobRepository.insertIfAbsent(job("sub-free", ServiceTier.FREE, 600));
    final Instant now = OPENED_AT.plusSeconds(11);

    final List<DelayJobRecord> first =
        delayJobRepository.claimDue(10, now, now.plusSeconds(60), "worker-1");
    final List<DelayJobRecord> second =
        delayJobRepository.claimDue(10, now, now.plusSeconds(60), "worker-2");

    assertThat(first).extracting(DelayJobRecord::subscriberId).containsExactly("sub-pro");
    assertThat(first.get(0).status()).isEqualTo(DelayJobStatus.PROCESSING);
    assertThat(first.get(0).lockedBy()).isEqualTo("worker-1");
    assertThat(second).isEmpty();
  }

  @Test
  void concurrentClaimsNeverShareAJob() throws Exception {
    for (int i = 0; i < 20; i++) {
      delayJobRepository.insertIfAbsent(job("sub-" + i, ServiceTier.PRO, 10));
    }
    final Instant now = OPENED_AT.plusSeconds(11);
    final ExecutorService executor = Executors.newFixedThreadPool(2);
    final CountDownLatch start = new CountDownLatch(1);
    try {
      final List<Future<List<DelayJobRecord>>> claims = new ArrayList<>();
      for (String worker : List.of("worker-1", "worker-2")) {
        claims.add(
            executor.submit(
                () -> {
                  start.await();
                  return delayJobRepository.claimDue(20, now, now.plusSeconds(60), worker);
                }));
      }
      start.countDown();

      final List<UUID> claimedIds = new ArrayList<>();
      for (Future<List<DelayJobRecord>> claim : claims) {
        claim.get(30, TimeUnit.SECONDS).forEach(job -> claimedIds.add(job.jobId()));
      }
      assertThat(claimedIds).hasSize(20).doesNotHaveDuplicates();
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void completionRequiresTheClaimingWorker() {
    final DelayJobRecord job = job("sub-1", ServiceTier.PRO, 10);
    delayJobRepository.insertIfAbsent(job);
    final Instant now = OPENED_AT.plusSeconds(10);
    delayJobRepository.claimDue(10, now, now.plusSeconds(60), "worker-1");

    assertThat(delayJobRepository.markSent(job.jobId(), now, "worker-2")).isZero();
    assertThat(delayJobRepository.markSent(job.jobId(), now, "worker-1")).isEqualTo(1);
    assertThat(delayJobRepository.findById(job.jobId()))
        .map(DelayJobRecord::status)
        .contains(DelayJobStatus.SENT);
  }

  @Test
  void retryWaitsForNextRetryAt() {
    final DelayJobRecord job = job("sub-1", ServiceTier.PRO, 10);
    delayJobRepository.insertIfAbsent(job);
    final Instant now = OPENED_AT.plusSeconds(10);
    delayJobRepository.claimDue(10, now, now.plusSeconds(60), "worker-1");

    delayJobRepository.markRetry(
        job.jobId(), 1, now.plusSeconds(5), false, "PUSH: timeout", "worker-1");

    assertThat(delayJobRepository.claimDue(10, now.plusSeconds(4), now.plusSeconds(64), "w"))
        .isEmpty();
    assertThat(delayJobRepository.claimDue(10, now.plusSeconds(5), now.plusSeconds(65), "w"))
        .extracting(DelayJobRecord::attemptCount)
        .containsExactly(1);
  }

  @Test
  void releaseStaleClaimsReturnsAbandonedJobsToPending() {
    final DelayJobRecord job = job("sub-1", ServiceTier.PRO, 10);
    delayJobRepository.insertIfAbsent(job);
    final Instant claimedAt = OPENED_AT.plusSeconds(10);
    delayJobRepository.claimDue(10, claimedAt, claimedAt.plusSeconds(60), "worker-1");

    assertThat(delayJobRepository.releaseStaleClaims(claimedAt)).isZero();
    assertThat(delayJobRepository.releaseStaleClaims(claimedAt.plusSeconds(1))).isEqualTo(1);
    assertThat(delayJobRepository.findById(job.jobId()))
        .map(DelayJobRecord::status)
        .contains(DelayJobStatus.PENDING);
  }

  @Test
  void deleteUnclaimedLeavesClaimedJobsInPlace() {
    final DelayJobRecord job = job("sub-1", ServiceTier.PRO, 10);
    delayJobRepository.insertIfAbsent(job);
    final Instant now = OPENED_AT.plusSeconds(10);
    delayJobRepository.claimDue(10, now, now.plusSeconds(60), "worker-1");

    assertThat(delayJobRepository.deleteUnclaimed("sub-1", 1001)).isZero();
    assertThat(delayJobRepository.findById(job.jobId())).isPresent();
  }

  @Test
  void requeueFailedResetsAttemptsAndSendsNow() {
    final DelayJobRecord job = job("sub-1", ServiceTier.PRO, 10);
    delayJobRepository.insertIfAbsent(job);
    final Instant now = OPENED_AT.plusSeconds(10);
    delayJobRepository.claimDue(10, now, now.plusSeconds(60), "worker-1");
    delayJobRepository.markRetry(job.jobId(), 3, null, true, "all channels failed", "worker-1");
    final Instant requeuedAt = OPENED_AT.plusSeconds(3600);

    assertThat(delayJobRepository.requeueFailed(job.jobId(), requeuedAt)).isEqualTo(1);
    assertThat(delayJobRepository.requeueFailed(job.jobId(), requeuedAt)).isZero();
    final DelayJobRecord stored = delayJobRepository.findById(job.jobId()).orElseThrow();
    assertThat(stored.status()).isEqualTo(DelayJobStatus.PENDING);
    assertThat(stored.attemptCount()).isZero();
    assertThat(stored.sendAt()).isEqualTo(requeuedAt);
  }

  @Test
  void retentionDeleteKeepsSentJobsOfTheirPair() {
    final DelayJobRecord sent = job("sub-1", ServiceTier.PRO, 10);
    final DelayJobRecord cancelled = job("sub-2", ServiceTier.PRO, 10);
    delayJobRepository.insertIfAbsent(sent);
    delayJobRepository.insertIfAbsent(cancelled);
    final Instant now = OPENED_AT.plusSeconds(10);
    delayJobRepository.claimDue(10, now, now.plusSeconds(60), "worker-1");
    delayJobRepository.markSent(sent.jobId(), now, "worker-1");
    delayJobRepository.markCancelled(cancelled.jobId(), "subscription removed", "worker-1");

    final int deleted = delayJobRepository.deleteCancelledOlderThan(OPENED_AT.plusSeconds(1));

    assertThat(deleted).isEqualTo(1);
    assertThat(delayJobRepository.findById(sent.jobId())).isPresent();
    assertThat(delayJobRepository.findById(cancelled.jobId())).isEmpty();
    assertThat(delayJobRepository.insertIfAbsent(job("sub-1", ServiceTier.FREE, 600))).isZero();
  }

  private static DelayJobRecord job(String subscriberId, ServiceTier tier, long delaySeconds) {
    return DelayJobRecord.pending(
        subscriberId, 1001, tier, OPENED_AT, OPENED_AT.plusSeconds(delaySeconds), OPENED_AT);
  }
}
