/*
 * Where: Watch cleanup worker
 * What: Triggers retention cleanup on a schedule
 * Why: Automate deletion without manual intervention
 */
package com.engagewatch.watch.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "watch.retention.enabled", havingValue = "true")
public class RetentionWorker {

  static final String NAME = "retention";

  private final RetentionService retentionService;
  private final WorkerHaltGuard haltGuard;

  @Scheduled(fixedDelayString = "${watch.retention.cleanup-interval}")
  public void run() {
    haltGuard.run(NAME, retentionService::cleanup);
  }
}
