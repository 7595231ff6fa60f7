/*
 * Where: Watch service layer
 * What: Delivers due delay jobs over every enabled channel and handles retry and permanent failure
 * Why: The notified flag, the log entries and the SENT status must commit together so a
 *      subscriber is notified at most once
 */
package com.engagewatch.watch.service;

import com.engagewatch.common.WorkerIdentity;
import com.engagewatch.watch.channel.ChannelDeliveryException;
import com.engagewatch.watch.channel.DeliveryRequest;
import com.engagewatch.watch.channel.NotificationChannel;
import com.engagewatch.watch.client.SubscriberDirectory;
import com.engagewatch.watch.client.SubscriberLookupException;
import com.engagewatch.watch.config.DispatchProperties;
import com.engagewatch.watch.config.ExecutorConfig;
import com.engagewatch.watch.model.ChannelType;
import com.engagewatch.watch.model.DelayJobRecord;
import com.engagewatch.watch.model.DeliveryFailureRecord;
import com.engagewatch.watch.model.DispatchOutcome;
import com.engagewatch.watch.model.NotificationLogEntry;
import com.engagewatch.watch.model.ResourceRecord;
import com.engagewatch.watch.model.SubscriberProfile;
import com.engagewatch.watch.model.SubscriptionRecord;
import com.engagewatch.watch.repository.DelayJobRepository;
import com.engagewatch.watch.repository.DeliveryFailureRepository;
import com.engagewatch.watch.repository.NotificationLogRepository;
import com.engagewatch.watch.repository.ResourceRepository;
import com.engagewatch.watch.repository.SubscriptionRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class DispatchService {

  private static final Logger logger = LoggerFactory.getLogger(DispatchService.class);

  private final DelayJobRepository delayJobRepository;
  private final SubscriptionRepository subscriptionRepository;
  private final ResourceRepository resourceRepository;
  private final NotificationLogRepository notificationLogRepository;
  private final DeliveryFailureRepository deliveryFailureRepository;
  private final SubscriberDirectory subscriberDirectory;
  private final List<NotificationChannel> channels;
  private final DispatchProperties properties;
  private final WatchMetrics metrics;
  private final OperatorAlertService alerts;
  private final WorkerIdentity workerIdentity;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;
  private final Executor dispatchExecutor;

  public DispatchService(
      DelayJobRepository delayJobRepository,
      SubscriptionRepository subscriptionRepository,
      ResourceRepository resourceRepository,
      NotificationLogRepository notificationLogRepository,
      DeliveryFailureRepository deliveryFailureRepository,
      SubscriberDirectory subscriberDirectory,
      List<NotificationChannel> channels,
      DispatchProperties properties,
      WatchMetrics metrics,
      OperatorAlertService alerts,
      WorkerIdentity workerIdentity,
      Clock clock,
      PlatformTransactionManager transactionManager,
      @Qualifier(ExecutorConfig.DISPATCH_EXECUTOR) Executor dispatchExecutor) {
    this.delayJobRepository = delayJobRepository;
    this.subscriptionRepository = subscriptionRepository;
    this.resourceRepository = resourceRepository;
    this.notificationLogRepository = notificationLogRepository;
    this.deliveryFailureRepository = deliveryFailureRepository;
    this.subscriberDirectory = subscriberDirectory;
    this.channels = List.copyOf(channels);
    this.properties = properties;
    this.metrics = metrics;
    this.alerts = alerts;
    this.workerIdentity = workerIdentity;
    this.clock = clock;
    this.transactionManager = transactionManager;
    this.dispatchExecutor = dispatchExecutor;
  }

  /** Claims due jobs and dispatches them in parallel; returns the number claimed. */
  public int processDueBatch() {
    final List<DelayJobRecord> jobs = claimDueJobs(properties.batchSize());
    if (!jobs.isEmpty()) {
      final List<CompletableFuture<DispatchOutcome>> results =
          jobs.stream()
              .map(job -> CompletableFuture.supplyAsync(() -> dispatch(job), dispatchExecutor))
              .toList();
      DataAccessResourceFailureException storeFailure = null;
      for (int i = 0; i < results.size(); i++) {
        try {
          results.get(i).join();
        } catch (CompletionException ex) {
          final Throwable cause = ex.getCause() == null ? ex : ex.getCause();
          if (cause instanceof DataAccessResourceFailureException failure) {
            storeFailure = failure;
          } else {
            logger.error("dispatch failed unexpectedly jobId={}", jobs.get(i).jobId(), cause);
          }
        }
      }
      if (storeFailure != null) {
        throw storeFailure;
      }
    }
    metrics.updateBacklog(delayJobRepository.countDue(Instant.now(clock)));
    return jobs.size();
  }

  /** Atomically claims up to {@code limit} due PENDING jobs for this worker. */
  public List<DelayJobRecord> claimDueJobs(int limit) {
    final Instant now = Instant.now(clock);
    // claim is a single statement so channel IO never runs inside a long transaction
    return delayJobRepository.claimDue(
        limit, now, now.plus(properties.lease()), workerIdentity.lockedBy());
  }

  public DispatchOutcome dispatch(DelayJobRecord job) {
    final String lockedBy = job.lockedBy();
    final Optional<SubscriptionRecord> subscription =
        subscriptionRepository.find(job.subscriberId(), job.resourceId());
    if (subscription.isEmpty() || subscription.get().notified()) {
      final String reason =
          subscription.isEmpty() ? "subscription removed" : "subscriber already notified";
      return cancel(job, reason, lockedBy);
    }
    final Optional<ResourceRecord> resource = resourceRepository.findById(job.resourceId());
    if (resource.isEmpty()) {
      return cancel(job, "resource removed", lockedBy);
    }

    final SubscriberProfile profile;
    try {
      profile = subscriberDirectory.findProfile(job.subscriberId());
    } catch (SubscriberLookupException ex) {
      return handleFailure(
          job, "profile lookup failed: " + ex.reason() + " " + ex.getMessage(), lockedBy);
    }

    final List<NotificationChannel> enabled =
        channels.stream().filter(channel -> channel.isAvailableFor(profile)).toList();
    if (enabled.isEmpty()) {
      return handleFailure(job, "no enabled channel", lockedBy);
    }

    final DeliveryRequest request =
        new DeliveryRequest(
            job.jobId(),
            profile,
            job.resourceId(),
            resource.get().displayName(),
            resource.get().status(),
            job.tier(),
            job.openedAt());
    final List<ChannelType> delivered = new ArrayList<>();
    final List<String> errors = new ArrayList<>();
    for (NotificationChannel channel : enabled) {
      try {
        channel.deliver(request);
        delivered.add(channel.type());
        metrics.recordDeliveryResult(channel.type(), "success");
      } catch (ChannelDeliveryException ex) {
        errors.add(channel.type() + ": " + ex.getMessage());
        metrics.recordDeliveryResult(channel.type(), "failure");
        logger.warn(
            "channel delivery failed jobId={} channel={} subscriberId={}",
            job.jobId(),
            channel.type(),
            job.subscriberId(),
            ex);
      } catch (RuntimeException ex) {
        errors.add(channel.type() + ": " + ex.getMessage());
        metrics.recordDeliveryResult(channel.type(), "failure");
        logger.warn(
            "channel delivery failed unexpectedly jobId={} channel={}",
            job.jobId(),
            channel.type(),
            ex);
      }
    }
    if (delivered.isEmpty()) {
      return handleFailure(job, String.join("; ", errors), lockedBy);
    }
    return completeSent(job, delivered, lockedBy);
  }

  private DispatchOutcome completeSent(
      DelayJobRecord job, List<ChannelType> delivered, String lockedBy) {
    final Instant now = Instant.now(clock);
    final long delaySeconds = Math.max(Duration.between(job.openedAt(), now).getSeconds(), 0L);
    // log entries, notified flag and SENT commit together
    final Boolean sent =
        transactionTemplate()
            .execute(
                status -> {
                  for (ChannelType channel : delivered) {
                    notificationLogRepository.insert(
                        new NotificationLogEntry(
                            UUID.randomUUID(),
                            job.jobId(),
                            job.subscriberId(),
                            job.resourceId(),
                            channel,
                            job.tier(),
                            delaySeconds,
                            now));
                  }
                  subscriptionRepository.markNotified(job.subscriberId(), job.resourceId(), now);
                  final int updated = delayJobRepository.markSent(job.jobId(), now, lockedBy);
                  if (updated == 0) {
                    status.setRollbackOnly();
                    return false;
                  }
                  return true;
                });
    if (!Boolean.TRUE.equals(sent)) {
      logger.warn(
          "delay job delivered but lock was lost jobId={} subscriberId={} resourceId={}",
          job.jobId(),
          job.subscriberId(),
          job.resourceId());
      return DispatchOutcome.LOCK_LOST;
    }
    metrics.recordDeliveryDelay(job.tier().name(), job.openedAt(), now);
    logger.info(
        "subscriber notified jobId={} subscriberId={} resourceId={} tier={} channels={}"
            + " delaySeconds={}",
        job.jobId(),
        job.subscriberId(),
        job.resourceId(),
        job.tier(),
        delivered,
        delaySeconds);
    return DispatchOutcome.SENT;
  }

  private DispatchOutcome cancel(DelayJobRecord job, String reason, String lockedBy) {
    final int updated = delayJobRepository.markCancelled(job.jobId(), reason, lockedBy);
    if (updated == 0) {
      logger.warn("delay job cancel skipped because lock was lost jobId={}", job.jobId());
      return DispatchOutcome.LOCK_LOST;
    }
    logger.info(
        "delay job cancelled jobId={} subscriberId={} resourceId={} reason={}",
        job.jobId(),
        job.subscriberId(),
        job.resourceId(),
        reason);
    return DispatchOutcome.CANCELLED;
  }

  @VisibleForTesting
  DispatchOutcome handleFailure(DelayJobRecord job, String error, String lockedBy) {
    final Instant now = Instant.now(clock);
    final int nextAttempt = job.attemptCount() + 1;
    final String lastError = truncateError(error);
    if (nextAttempt >= properties.maxAttempts()) {
      if (!markFailedWithRecord(job, nextAttempt, lastError, now, lockedBy)) {
        logger.warn(
            "delay job failure record skipped because lock was lost jobId={}", job.jobId());
        return DispatchOutcome.LOCK_LOST;
      }
      metrics.recordDeliveryFailed();
      logger.error(
          "delay job failed permanently jobId={} subscriberId={} resourceId={} attempts={}"
              + " error={}",
          job.jobId(),
          job.subscriberId(),
          job.resourceId(),
          nextAttempt,
          lastError);
      alerts.alert(
          "delivery failed permanently jobId="
              + job.jobId()
              + " subscriberId="
              + job.subscriberId()
              + " resourceId="
              + job.resourceId()
              + "; requeue with POST /v1/delay-jobs/"
              + job.jobId()
              + "/requeue");
      return DispatchOutcome.FAILED;
    }
    final Duration backoff = computeBackoffDuration(nextAttempt);
    final int updated =
        delayJobRepository.markRetry(
            job.jobId(), nextAttempt, now.plus(backoff), false, lastError, lockedBy);
    if (updated == 0) {
      logger.warn(
          "delay job retry skipped because lock was lost jobId={} attempt={}",
          job.jobId(),
          nextAttempt);
      return DispatchOutcome.LOCK_LOST;
    }
    logger.warn(
        "delay job retry scheduled jobId={} attempt={} retryIn={} error={}",
        job.jobId(),
        nextAttempt,
        backoff,
        lastError);
    return DispatchOutcome.RETRY_SCHEDULED;
  }

  private boolean markFailedWithRecord(
      DelayJobRecord job, int nextAttempt, String lastError, Instant now, String lockedBy) {
    final Boolean updated =
        transactionTemplate()
            .execute(
                status -> {
                  deliveryFailureRepository.insert(
                      new DeliveryFailureRecord(
                          UUID.randomUUID(),
                          job.jobId(),
                          job.subscriberId(),
                          job.resourceId(),
                          job.tier(),
                          nextAttempt,
                          lastError,
                          now));
                  final int count =
                      delayJobRepository.markRetry(
                          job.jobId(), nextAttempt, null, true, lastError, lockedBy);
                  if (count == 0) {
                    status.setRollbackOnly();
                    return false;
                  }
                  return true;
                });
    return Boolean.TRUE.equals(updated);
  }

  /**
   * Returns a FAILED job to the queue with its attempts reset and clears its failure record.
   *
   * @return false when the job does not exist or is not FAILED
   */
  public boolean requeueFailed(UUID jobId) {
    final Instant now = Instant.now(clock);
    final Boolean requeued =
        transactionTemplate()
            .execute(
                status -> {
                  if (delayJobRepository.requeueFailed(jobId, now) == 0) {
                    return false;
                  }
                  deliveryFailureRepository.deleteByJobId(jobId);
                  return true;
                });
    if (Boolean.TRUE.equals(requeued)) {
      logger.info("delay job requeued jobId={}", jobId);
      return true;
    }
    return false;
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffExponentBase(), attempt - 1);
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    final long backoffMillis = (long) Math.ceil(capped * jitter);
    return Duration.ofMillis(Math.max(properties.backoffMin().toMillis(), backoffMillis));
  }

  @VisibleForTesting
  String truncateError(String message) {
    if (message == null || message.isBlank()) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  @VisibleForTesting
  TransactionTemplate transactionTemplate() {
    return new TransactionTemplate(transactionManager);
  }
}
