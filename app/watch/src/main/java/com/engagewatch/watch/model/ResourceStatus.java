/*
 * Where: Watch domain model
 * What: Lifecycle states of a watched registration page
 * Why: Only UNOPENED -> OPEN_* may trigger a fan-out
 */
package com.engagewatch.watch.model;

public enum ResourceStatus {
  UNOPENED,
  OPEN_STANDARD,
  OPEN_RESTRICTED,
  TERMINAL;

  public boolean isOpen() {
    return this == OPEN_STANDARD || this == OPEN_RESTRICTED;
  }
}
