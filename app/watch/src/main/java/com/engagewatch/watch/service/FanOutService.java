/*
 * Where: Watch service layer
 * What: Claims pending opening events and runs the fan-out for each
 * Why: The opening event is written with the open transition, so fan-out resumes after a crash
 */
package com.engagewatch.watch.service;

import com.engagewatch.common.WorkerIdentity;
import com.engagewatch.watch.config.FanOutProperties;
import com.engagewatch.watch.model.OpeningEventRecord;
import com.engagewatch.watch.repository.OpeningEventRepository;
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
public class FanOutService {

  private static final Logger logger = LoggerFactory.getLogger(FanOutService.class);

  private final OpeningEventRepository openingEventRepository;
  private final FanOutCoordinator coordinator;
  private final FanOutProperties properties;
  private final WorkerIdentity workerIdentity;
  private final Clock clock;

  /** Returns the number of events claimed in this cycle. */
  public int processPendingEvents() {
    final Instant now = Instant.now(clock);
    final String lockedBy = workerIdentity.lockedBy();
    final List<OpeningEventRecord> events =
        openingEventRepository.claimPending(
            properties.batchSize(), now, now.plus(properties.lease()), lockedBy);
    for (OpeningEventRecord event : events) {
      try {
        coordinator.handleOpened(event.resourceId(), event.openedAt());
        final int updated =
            openingEventRepository.markDone(event.eventId(), Instant.now(clock), lockedBy);
        if (updated == 0) {
          logger.warn(
              "opening event done but lock was lost eventId={} resourceId={}",
              event.eventId(),
              event.resourceId());
        }
      } catch (DataAccessResourceFailureException ex) {
        throw ex;
      } catch (RuntimeException ex) {
        openingEventRepository.release(event.eventId(), lockedBy);
        logger.warn(
            "fan-out failed; event released eventId={} resourceId={} attempt={}",
            event.eventId(),
            event.resourceId(),
            event.attemptCount(),
            ex);
      }
    }
    return events.size();
  }
}
