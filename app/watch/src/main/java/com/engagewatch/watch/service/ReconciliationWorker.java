/*
 * Where: Watch recovery worker
 * What: Runs reconciliation once the application is ready and then on an optional schedule
 * Why: Work interrupted by a crash is repaired before the next opening arrives
 */
package com.engagewatch.watch.service;

import com.engagewatch.watch.config.ReconciliationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ReconciliationWorker {

  static final String NAME = "reconciliation";

  private final ReconciliationService reconciliationService;
  private final ReconciliationProperties properties;
  private final WorkerHaltGuard haltGuard;

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    if (properties.runOnStartup()) {
      haltGuard.run(NAME, reconciliationService::reconcile);
    }
  }

  @Scheduled(fixedDelayString = "${watch.reconciliation.interval:PT5M}")
  public void run() {
    if (properties.enabled()) {
      haltGuard.run(NAME, reconciliationService::reconcile);
    }
  }
}
