/*
 * Where: Watch service layer
 * What: Checks resources, classifies readings and records the one-way open transition
 * Why: An opening must be emitted exactly once even with several pollers running
 */
package com.engagewatch.watch.service;

import com.engagewatch.common.WorkerIdentity;
import com.engagewatch.watch.client.ResourceFetchException;
import com.engagewatch.watch.client.ResourceStatusFetcher;
import com.engagewatch.watch.config.ExecutorConfig;
import com.engagewatch.watch.config.PollerProperties;
import com.engagewatch.watch.model.CheckOutcome;
import com.engagewatch.watch.model.RawStatusReading;
import com.engagewatch.watch.model.ResourceCheckRecord;
import com.engagewatch.watch.model.ResourceRecord;
import com.engagewatch.watch.model.ResourceStatus;
import com.engagewatch.watch.repository.OpeningEventRepository;
import com.engagewatch.watch.repository.ResourceCheckRepository;
import com.engagewatch.watch.repository.ResourceRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class StatusPollService {

  private static final Logger logger = LoggerFactory.getLogger(StatusPollService.class);

  private final ResourceRepository resourceRepository;
  private final OpeningEventRepository openingEventRepository;
  private final ResourceCheckRepository resourceCheckRepository;
  private final ResourceStatusFetcher fetcher;
  private final ResourceStatusClassifier classifier;
  private final WatchMetrics metrics;
  private final PollerProperties properties;
  private final WorkerIdentity workerIdentity;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;
  private final Executor pollExecutor;

  public StatusPollService(
      ResourceRepository resourceRepository,
      OpeningEventRepository openingEventRepository,
      ResourceCheckRepository resourceCheckRepository,
      ResourceStatusFetcher fetcher,
      ResourceStatusClassifier classifier,
      WatchMetrics metrics,
      PollerProperties properties,
      WorkerIdentity workerIdentity,
      Clock clock,
      PlatformTransactionManager transactionManager,
      @Qualifier(ExecutorConfig.POLL_EXECUTOR) Executor pollExecutor) {
    this.resourceRepository = resourceRepository;
    this.openingEventRepository = openingEventRepository;
    this.resourceCheckRepository = resourceCheckRepository;
    this.fetcher = fetcher;
    this.classifier = classifier;
    this.metrics = metrics;
    this.properties = properties;
    this.workerIdentity = workerIdentity;
    this.clock = clock;
    this.transactionManager = transactionManager;
    this.pollExecutor = pollExecutor;
  }

  /**
   * Checks one resource now. Returns {@link CheckOutcome#SKIPPED_BUSY} without fetching when
   * another worker holds the poll lease.
   */
  public CheckOutcome checkOne(long resourceId) {
    final Instant now = Instant.now(clock);
    final String leaseToken = workerIdentity.newLeaseToken();
    final Optional<ResourceRecord> leased =
        resourceRepository.tryAcquirePollLease(
            resourceId, now, now.plus(properties.lease()), leaseToken);
    if (leased.isEmpty()) {
      if (resourceRepository.findById(resourceId).isEmpty()) {
        throw ResourceNotFoundException.resource(resourceId);
      }
      logger.debug("status check skipped; lease held elsewhere resourceId={}", resourceId);
      metrics.recordCheck(CheckOutcome.SKIPPED_BUSY);
      return CheckOutcome.SKIPPED_BUSY;
    }
    return checkLeased(leased.get(), leaseToken);
  }

  /** Claims due resources and checks them on the poll executor; returns the number claimed. */
  public int pollDueBatch() {
    final Instant now = Instant.now(clock);
    final List<ResourceRecord> claimed =
        resourceRepository.claimDueForPoll(
            properties.batchSize(),
            now,
            now.plus(properties.lease()),
            workerIdentity.lockedBy());
    if (claimed.isEmpty()) {
      return 0;
    }
    final List<CompletableFuture<CheckOutcome>> checks =
        claimed.stream()
            .map(
                resource ->
                    CompletableFuture.supplyAsync(
                        () -> checkLeased(resource, resource.pollLockedBy()), pollExecutor))
            .toList();
    DataAccessResourceFailureException storeFailure = null;
    for (int i = 0; i < checks.size(); i++) {
      try {
        checks.get(i).join();
      } catch (CompletionException ex) {
        final Throwable cause = ex.getCause() == null ? ex : ex.getCause();
        if (cause instanceof DataAccessResourceFailureException failure) {
          storeFailure = failure;
        } else {
          logger.error(
              "status check failed unexpectedly resourceId={}",
              claimed.get(i).resourceId(),
              cause);
        }
      }
    }
    if (storeFailure != null) {
      throw storeFailure;
    }
    logger.debug("status poll batch finished claimed={}", claimed.size());
    return claimed.size();
  }

  @VisibleForTesting
  CheckOutcome checkLeased(ResourceRecord resource, String leaseToken) {
    final long startedNanos = System.nanoTime();
    final RawStatusReading reading;
    try {
      reading = fetcher.fetch(resource.resourceId());
    } catch (ResourceFetchException ex) {
      return recordFailure(resource, leaseToken, ex, elapsedSince(startedNanos));
    }
    final Duration elapsed = elapsedSince(startedNanos);
    metrics.recordFetchLatency(elapsed);
    final ResourceStatus observed = classifier.classify(resource.resourceId(), reading);
    return applyReading(resource, leaseToken, observed, reading, elapsed);
  }

  private CheckOutcome applyReading(
      ResourceRecord resource,
      String leaseToken,
      ResourceStatus observed,
      RawStatusReading reading,
      Duration elapsed) {
    final long resourceId = resource.resourceId();
    final ResourceStatus stored = resource.status();
    final Instant now = Instant.now(clock);
    final Instant nextCheckAt = now.plus(properties.checkInterval());

    final CheckOutcome outcome;
    final ResourceStatus toStore;
    if (stored == ResourceStatus.UNOPENED && observed.isOpen()) {
      final boolean opened = openAndEmit(resource, leaseToken, observed, reading, now, nextCheckAt);
      outcome = opened ? CheckOutcome.OPENED : CheckOutcome.UNCHANGED;
      toStore = observed;
    } else {
      if (stored == ResourceStatus.TERMINAL) {
        toStore = ResourceStatus.TERMINAL;
        outcome = CheckOutcome.UNCHANGED;
      } else if (stored.isOpen() && observed == ResourceStatus.UNOPENED) {
        logger.warn(
            "open resource reads as closed again; keeping stored status resourceId={} stored={}"
                + " label={}",
            resourceId,
            stored,
            reading.label());
        toStore = stored;
        outcome = CheckOutcome.REVERSION_IGNORED;
      } else {
        toStore = observed;
        outcome = observed == stored ? CheckOutcome.UNCHANGED : CheckOutcome.CHANGED;
      }
      final int updated =
          resourceRepository.recordCheckSuccess(
              resourceId, leaseToken, toStore, reading.metadata(), now, nextCheckAt);
      if (updated == 0) {
        logger.warn("status check result stored after lease was lost resourceId={}", resourceId);
      }
      if (outcome == CheckOutcome.CHANGED) {
        logger.info(
            "resource status changed resourceId={} from={} to={}", resourceId, stored, toStore);
      }
    }

    resourceCheckRepository.insert(
        new ResourceCheckRecord(
            UUID.randomUUID(), resourceId, now, stored, toStore, elapsed.toMillis(), true, null));
    metrics.recordCheck(outcome);
    return outcome;
  }

  private boolean openAndEmit(
      ResourceRecord resource,
      String leaseToken,
      ResourceStatus observed,
      RawStatusReading reading,
      Instant now,
      Instant nextCheckAt) {
    final long resourceId = resource.resourceId();
    // open flag, opening event and check result commit together
    final Boolean opened =
        transactionTemplate()
            .execute(
                status -> {
                  final Optional<Instant> openedAt =
                      resourceRepository.markOpened(resourceId, observed, now);
                  openedAt.ifPresent(
                      at ->
                          openingEventRepository.insertIfAbsent(
                              UUID.randomUUID(), resourceId, at, now));
                  resourceRepository.recordCheckSuccess(
                      resourceId, leaseToken, observed, reading.metadata(), now, nextCheckAt);
                  return openedAt.isPresent();
                });
    if (Boolean.TRUE.equals(opened)) {
      metrics.recordOpening();
      logger.info("resource opened resourceId={} status={} openedAt={}", resourceId, observed, now);
      return true;
    }
    logger.info("resource already open; opening not emitted again resourceId={}", resourceId);
    return false;
  }

  private CheckOutcome recordFailure(
      ResourceRecord resource, String leaseToken, ResourceFetchException ex, Duration elapsed) {
    final Instant now = Instant.now(clock);
    final int failures = resource.consecutiveFailures() + 1;
    final Duration backoff = computeFailureBackoff(failures);
    resourceRepository.recordCheckFailure(
        resource.resourceId(), leaseToken, now, now.plus(backoff));
    resourceCheckRepository.insert(
        new ResourceCheckRecord(
            UUID.randomUUID(),
            resource.resourceId(),
            now,
            resource.status(),
            resource.status(),
            elapsed.toMillis(),
            false,
            ex.reason().name()));
    logger.warn(
        "status check failed resourceId={} reason={} consecutiveFailures={} retryIn={}",
        resource.resourceId(),
        ex.reason(),
        failures,
        backoff);
    metrics.recordCheck(CheckOutcome.FAILED);
    return CheckOutcome.FAILED;
  }

  /** Exponential backoff from the failure base, never shorter than the regular interval. */
  @VisibleForTesting
  Duration computeFailureBackoff(int consecutiveFailures) {
    final int exponent = Math.min(Math.max(consecutiveFailures - 1, 0), 30);
    final long baseMillis = properties.failureBackoffBase().toMillis();
    final long maxMillis = properties.failureBackoffMax().toMillis();
    final double exp = baseMillis * Math.pow(2.0d, exponent);
    final long capped = (long) Math.min(exp, maxMillis);
    return Duration.ofMillis(Math.max(capped, properties.checkInterval().toMillis()));
  }

  @VisibleForTesting
  TransactionTemplate transactionTemplate() {
    return new TransactionTemplate(transactionManager);
  }

  private static Duration elapsedSince(long startedNanos) {
    return Duration.ofNanos(System.nanoTime() - startedNanos);
  }
}
