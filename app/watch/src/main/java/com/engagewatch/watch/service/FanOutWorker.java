package com.engagewatch.watch.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "watch.fanout.enabled", havingValue = "true", matchIfMissing = true)
public class FanOutWorker {

  static final String NAME = "fan-out";

  private final FanOutService fanOutService;
  private final WorkerHaltGuard haltGuard;

  @Scheduled(fixedDelayString = "${watch.fanout.poll-interval}")
  public void run() {
    haltGuard.run(NAME, fanOutService::processPendingEvents);
  }
}
