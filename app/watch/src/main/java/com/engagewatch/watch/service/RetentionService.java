/*
 * Where: Watch service layer
 * What: Applies the retention policy to check history and cancelled delay jobs
 * Why: Prevent unbounded growth while keeping anomalous active jobs visible
 */
package com.engagewatch.watch.service;

import com.engagewatch.watch.config.RetentionProperties;
import com.engagewatch.watch.repository.DelayJobRepository;
import com.engagewatch.watch.repository.ResourceCheckRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RetentionService {

  private static final Logger logger = LoggerFactory.getLogger(RetentionService.class);

  private final ResourceCheckRepository resourceCheckRepository;
  private final DelayJobRepository delayJobRepository;
  private final RetentionProperties properties;
  private final Clock clock;

  public void cleanup() {
    final Instant now = Instant.now(clock);
    final Instant threshold = now.minus(Duration.ofDays(properties.retentionDays()));
    final int staleActiveCount = delayJobRepository.countStaleActive(threshold);
    if (staleActiveCount > 0) {
      logger.error(
          "retention found stale active delay jobs count={} threshold={}",
          staleActiveCount,
          threshold);
    }
    final int deletedChecks = resourceCheckRepository.deleteOlderThan(threshold);
    final int deletedJobs = delayJobRepository.deleteCancelledOlderThan(threshold);
    logger.info(
        "retention cleanup deleted resourceChecks={} delayJobs={} threshold={}",
        deletedChecks,
        deletedJobs,
        threshold);
  }
}
