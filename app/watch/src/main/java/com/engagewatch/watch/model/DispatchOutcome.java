package com.engagewatch.watch.model;

/** Result of dispatching one claimed delay job. */
public enum DispatchOutcome {
  SENT,
  RETRY_SCHEDULED,
  FAILED,
  CANCELLED,
  LOCK_LOST
}
