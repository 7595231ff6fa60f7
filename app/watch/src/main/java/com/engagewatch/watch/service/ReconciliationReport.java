package com.engagewatch.watch.service;

/** Counts of repairs made by one reconciliation pass. */
public record ReconciliationReport(
    int resourcesRefanned,
    int resourcesFailed,
    int jobsCreated,
    int staleJobsReleased,
    int openingEventsReset) {

  public boolean isEmpty() {
    return resourcesRefanned == 0
        && resourcesFailed == 0
        && jobsCreated == 0
        && staleJobsReleased == 0
        && openingEventsReset == 0;
  }
}
