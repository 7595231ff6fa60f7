/*
 * Where: Watch domain model
 * What: Result of a single status check
 * Why: Lets callers and metrics tell a busy skip from a real poll
 */
package com.engagewatch.watch.model;

import java.util.Locale;

public enum CheckOutcome {
  /** Another worker holds the poll lease; nothing was fetched. */
  SKIPPED_BUSY,
  UNCHANGED,
  CHANGED,
  OPENED,
  /** An open resource read as closed again; the stored state was kept. */
  REVERSION_IGNORED,
  FAILED;

  public String metricValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
