/*
 * Where: Watch domain model
 * What: Unclassified result of fetching a registration page
 * Why: Keeps the fetch mechanism separate from classification rules
 */
package com.engagewatch.watch.model;

public record RawStatusReading(
    boolean restrictedActionAvailable,
    boolean standardActionAvailable,
    String label,
    ResourceMetadata metadata) {

  public RawStatusReading {
    metadata = metadata == null ? ResourceMetadata.empty() : metadata;
  }
}
