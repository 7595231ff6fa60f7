package com.engagewatch.watch.model;

import java.time.LocalDate;

/** Informational page details; any field may be null when the page does not show it. */
public record ResourceMetadata(
    String displayName, String location, LocalDate startDate, LocalDate endDate) {

  public static ResourceMetadata empty() {
    return new ResourceMetadata(null, null, null, null);
  }
}
