/*
 * Where: Watch service layer
 * What: Repairs state left behind by a crash between detection, fan-out and dispatch
 * Why: An open resource whose subscribers have no job would otherwise never be delivered
 */
package com.engagewatch.watch.service;

import com.engagewatch.watch.config.ReconciliationProperties;
import com.engagewatch.watch.model.ResourceRecord;
import com.engagewatch.watch.repository.DelayJobRepository;
import com.engagewatch.watch.repository.OpeningEventRepository;
import com.engagewatch.watch.repository.ResourceRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ReconciliationService {

  private static final Logger logger = LoggerFactory.getLogger(ReconciliationService.class);

  private final ResourceRepository resourceRepository;
  private final DelayJobRepository delayJobRepository;
  private final OpeningEventRepository openingEventRepository;
  private final FanOutCoordinator coordinator;
  private final ReconciliationProperties properties;
  private final Clock clock;

  public ReconciliationReport reconcile() {
    final Instant now = Instant.now(clock);
    final List<ResourceRecord> unscheduled =
        resourceRepository.findOpenWithUnscheduledSubscribers();
    int jobsCreated = 0;
    int failed = 0;
    for (ResourceRecord resource : unscheduled) {
      try {
        jobsCreated += coordinator.handleOpened(resource.resourceId(), resource.openedAt());
      } catch (DataAccessResourceFailureException ex) {
        throw ex;
      } catch (RuntimeException ex) {
        failed++;
        logger.warn(
            "reconciliation fan-out failed; retried next pass resourceId={}",
            resource.resourceId(),
            ex);
      }
    }
    final int staleReleased =
        delayJobRepository.releaseStaleClaims(now.minus(properties.staleClaimThreshold()));
    final int eventsReset = openingEventRepository.resetExpiredLeases(now);
    final ReconciliationReport report =
        new ReconciliationReport(
            unscheduled.size() - failed, failed, jobsCreated, staleReleased, eventsReset);
    if (report.isEmpty()) {
      logger.debug("reconciliation found nothing to repair");
    } else {
      logger.warn(
          "reconciliation repaired state resources={} failedResources={} jobsCreated={}"
              + " staleJobsReleased={} openingEventsReset={}",
          report.resourcesRefanned(),
          report.resourcesFailed(),
          report.jobsCreated(),
          report.staleJobsReleased(),
          report.openingEventsReset());
    }
    return report;
  }
}
