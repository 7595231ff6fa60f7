/*
 * Where: Watch poll worker
 * What: Triggers the status poll on a schedule
 * Why: Due resources are checked at a fixed cadence without an external trigger
 */
package com.engagewatch.watch.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "watch.poller.enabled", havingValue = "true", matchIfMissing = true)
public class StatusPollWorker {

  static final String NAME = "status-poll";

  private final StatusPollService pollService;
  private final WorkerHaltGuard haltGuard;

  @Scheduled(fixedDelayString = "${watch.poller.poll-interval}")
  public void run() {
    haltGuard.run(NAME, pollService::pollDueBatch);
  }
}
