/*
 * Where: Watch service layer
 * What: Turns one opening into a delay job per unnotified subscriber
 * Why: Each subscriber is notified on its own tier schedule, and a repeated fan-out must not
 *      create a second job for the same pair
 */
package com.engagewatch.watch.service;

import com.engagewatch.watch.client.TierLookup;
import com.engagewatch.watch.model.DelayJobRecord;
import com.engagewatch.watch.model.ServiceTier;
import com.engagewatch.watch.model.SubscriptionRecord;
import com.engagewatch.watch.repository.DelayJobRepository;
import com.engagewatch.watch.repository.SubscriptionRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class FanOutCoordinator {

  private static final Logger logger = LoggerFactory.getLogger(FanOutCoordinator.class);

  private final SubscriptionRepository subscriptionRepository;
  private final DelayJobRepository delayJobRepository;
  private final TierLookup tierLookup;
  private final TierDelayPolicy delayPolicy;
  private final WatchMetrics metrics;
  private final Clock clock;

  /** Returns the number of jobs created; pairs that already have a job are skipped. */
  public int handleOpened(long resourceId, Instant openedAt) {
    final List<SubscriptionRecord> subscriptions =
        subscriptionRepository.findUnnotifiedByResource(resourceId);
    int created = 0;
    for (SubscriptionRecord subscription : subscriptions) {
      final Instant now = Instant.now(clock);
      final ServiceTier tier = resolveTier(subscription.subscriberId());
      final Instant sendAt = delayPolicy.sendAt(tier, openedAt, now);
      final int inserted =
          delayJobRepository.insertIfAbsent(
              DelayJobRecord.pending(
                  subscription.subscriberId(), resourceId, tier, openedAt, sendAt, now));
      if (inserted == 0) {
        logger.debug(
            "delay job already exists subscriberId={} resourceId={}",
            subscription.subscriberId(),
            resourceId);
        continue;
      }
      created++;
    }
    metrics.recordJobsEnqueued(created);
    logger.info(
        "fan-out finished resourceId={} subscribers={} jobsCreated={}",
        resourceId,
        subscriptions.size(),
        created);
    return created;
  }

  private ServiceTier resolveTier(String subscriberId) {
    try {
      final ServiceTier tier = tierLookup.tierOf(subscriberId);
      if (tier != null) {
        return tier;
      }
      logger.warn("tier lookup returned no tier; using default subscriberId={}", subscriberId);
    } catch (RuntimeException ex) {
      logger.warn(
          "tier lookup failed; using default subscriberId={} defaultTier={}",
          subscriberId,
          delayPolicy.defaultTier(),
          ex);
    }
    return delayPolicy.defaultTier();
  }
}
