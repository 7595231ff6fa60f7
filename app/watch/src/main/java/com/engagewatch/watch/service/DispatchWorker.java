/*
 * Where: Watch dispatch worker
 * What: Starts a dispatch cycle on a schedule
 * Why: Due delay jobs are picked up within one poll interval of their send time
 */
package com.engagewatch.watch.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "watch.dispatch.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class DispatchWorker {

  static final String NAME = "dispatch";

  private final DispatchService dispatchService;
  private final WorkerHaltGuard haltGuard;

  @Scheduled(fixedDelayString = "${watch.dispatch.poll-interval}")
  public void run() {
    haltGuard.run(NAME, dispatchService::processDueBatch);
  }
}
