/*
 * Where: Watch service layer
 * What: Tracking, subscription, audit and statistics operations exposed to callers
 * Why: Keeps input validation and the subscription side effects out of the controller
 */
package com.engagewatch.watch.service;

import com.engagewatch.watch.model.DelayJobRecord;
import com.engagewatch.watch.model.DelayJobStatus;
import com.engagewatch.watch.model.GlobalStats;
import com.engagewatch.watch.model.ResourceCheckRecord;
import com.engagewatch.watch.model.ResourceRecord;
import com.engagewatch.watch.model.ResourceStats;
import com.engagewatch.watch.repository.DelayJobRepository;
import com.engagewatch.watch.repository.DeliveryFailureRepository;
import com.engagewatch.watch.repository.NotificationLogRepository;
import com.engagewatch.watch.repository.OpeningEventRepository;
import com.engagewatch.watch.repository.ResourceCheckRepository;
import com.engagewatch.watch.repository.ResourceRepository;
import com.engagewatch.watch.repository.SubscriptionRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class WatchService {

  private static final Logger logger = LoggerFactory.getLogger(WatchService.class);
  static final int MAX_CHECK_LIMIT = 100;

  private final ResourceRepository resourceRepository;
  private final SubscriptionRepository subscriptionRepository;
  private final DelayJobRepository delayJobRepository;
  private final NotificationLogRepository notificationLogRepository;
  private final DeliveryFailureRepository deliveryFailureRepository;
  private final ResourceCheckRepository resourceCheckRepository;
  private final OpeningEventRepository openingEventRepository;
  private final FanOutCoordinator coordinator;
  private final DispatchService dispatchService;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  /**
   * Starts tracking a resource; tracking an already tracked resource is a no-op. The resource is
   * due for its first check immediately and is polled until it turns TERMINAL, with or without
   * subscribers.
   */
  public ResourceRecord trackResource(long resourceId) {
    requireResourceId(resourceId);
    if (resourceRepository.insertIfAbsent(resourceId, Instant.now(clock)) > 0) {
      logger.info("resource tracked resourceId={}", resourceId);
    }
    return resourceRepository
        .findById(resourceId)
        .orElseThrow(() -> ResourceNotFoundException.resource(resourceId));
  }

  /**
   * Subscribes to a resource, tracking it first when needed. A subscription to a resource that
   * is already open is fanned out right away on its tier schedule.
   *
   * @return true when a new subscription was created
   */
  public boolean subscribe(String subscriberId, long resourceId) {
    requireSubscriberId(subscriberId);
    requireResourceId(resourceId);
    final Instant now = Instant.now(clock);
    final Boolean created =
        transactionTemplate()
            .execute(
                status -> {
                  resourceRepository.insertIfAbsent(resourceId, now);
                  if (subscriptionRepository.insertIfAbsent(subscriberId, resourceId, now) == 0) {
                    return false;
                  }
                  // a cancelled job of an earlier subscription must not block the new one
                  delayJobRepository.deleteUnclaimed(subscriberId, resourceId);
                  return true;
                });
    if (!Boolean.TRUE.equals(created)) {
      return false;
    }
    logger.info("subscription created subscriberId={} resourceId={}", subscriberId, resourceId);
    resourceRepository
        .findById(resourceId)
        .filter(ResourceRecord::open)
        .ifPresent(resource -> coordinator.handleOpened(resourceId, resource.openedAt()));
    return true;
  }

  /**
   * Removes a subscription together with its unclaimed delay job. A job already claimed by a
   * dispatcher cancels itself when it finds the subscription gone.
   */
  public boolean unsubscribe(String subscriberId, long resourceId) {
    requireSubscriberId(subscriberId);
    requireResourceId(resourceId);
    final Integer deleted =
        transactionTemplate()
            .execute(
                status -> {
                  final int jobs = delayJobRepository.deleteUnclaimed(subscriberId, resourceId);
                  final int subscriptions = subscriptionRepository.delete(subscriberId, resourceId);
                  if (jobs > 0) {
                    logger.info(
                        "pending delay job removed subscriberId={} resourceId={}",
                        subscriberId,
                        resourceId);
                  }
                  return subscriptions;
                });
    final boolean removed = deleted != null && deleted > 0;
    if (removed) {
      logger.info("subscription removed subscriberId={} resourceId={}", subscriberId, resourceId);
    }
    return removed;
  }

  public ResourceRecord getResourceStatus(long resourceId) {
    requireResourceId(resourceId);
    return resourceRepository
        .findById(resourceId)
        .orElseThrow(() -> ResourceNotFoundException.resource(resourceId));
  }

  public NotificationHistory listNotificationLog(String subscriberId) {
    requireSubscriberId(subscriberId);
    return new NotificationHistory(
        notificationLogRepository.findBySubscriber(subscriberId),
        deliveryFailureRepository.findBySubscriber(subscriberId));
  }

  public List<ResourceCheckRecord> listResourceChecks(long resourceId, int limit) {
    requireResourceId(resourceId);
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive");
    }
    if (resourceRepository.findById(resourceId).isEmpty()) {
      throw ResourceNotFoundException.resource(resourceId);
    }
    return resourceCheckRepository.findRecent(resourceId, Math.min(limit, MAX_CHECK_LIMIT));
  }

  /** Counts across every tracked resource; "today" starts at midnight UTC. */
  public GlobalStats getGlobalStats() {
    final Instant startOfDay = Instant.now(clock).truncatedTo(ChronoUnit.DAYS);
    return new GlobalStats(
        resourceRepository.countTracked(),
        resourceRepository.countOpen(),
        openingEventRepository.countAll(),
        resourceCheckRepository.countSince(startOfDay),
        resourceCheckRepository.summarizeAll());
  }

  public ResourceStats getResourceStats(long resourceId) {
    final ResourceRecord resource = getResourceStatus(resourceId);
    return new ResourceStats(
        resourceId,
        resource.status(),
        resource.openedAt(),
        resource.lastCheckedAt(),
        resourceCheckRepository.summarize(resourceId));
  }

  /** Sends a permanently failed job through the queue again. */
  public void requeueFailed(UUID jobId) {
    if (jobId == null) {
      throw new IllegalArgumentException("jobId is required");
    }
    final DelayJobRecord job =
        delayJobRepository
            .findById(jobId)
            .orElseThrow(() -> ResourceNotFoundException.delayJob(jobId));
    if (job.status() != DelayJobStatus.FAILED || !dispatchService.requeueFailed(jobId)) {
      throw new DelayJobStateException("delay job " + jobId + " is not FAILED");
    }
  }

  @VisibleForTesting
  TransactionTemplate transactionTemplate() {
    return new TransactionTemplate(transactionManager);
  }

  private static void requireResourceId(long resourceId) {
    if (resourceId <= 0) {
      throw new IllegalArgumentException("resourceId must be positive");
    }
  }

  private static void requireSubscriberId(String subscriberId) {
    if (subscriberId == null || subscriberId.isBlank()) {
      throw new IllegalArgumentException("subscriberId is required");
    }
  }
}
