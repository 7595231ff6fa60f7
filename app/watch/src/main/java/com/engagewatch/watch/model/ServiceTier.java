/*
 * Where: Watch domain model
 * What: Subscriber service tiers
 * Why: The tier decides how long a subscriber waits after an opening
 */
package com.engagewatch.watch.model;

import java.util.Locale;

public enum ServiceTier {
  FREE,
  PREMIUM,
  PRO;

  /** Parses a tier name case-insensitively; returns null for blank or unknown values. */
  public static ServiceTier parse(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return ServiceTier.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      return null;
    }
  }
}
