/*
 * Where: Watch service layer
 * What: Maps a raw page reading to a ResourceStatus
 * Why: Action indicators decide openness; the lifecycle label only separates closed from finished
 */
package com.engagewatch.watch.service;

import com.engagewatch.watch.model.RawStatusReading;
import com.engagewatch.watch.model.ResourceStatus;
import java.text.Normalizer;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ResourceStatusClassifier {

  private static final Logger logger = LoggerFactory.getLogger(ResourceStatusClassifier.class);

  private static final Set<String> UNOPENED_LABELS =
      Set.of("previsionnel", "ferme", "provisional", "closed", "not_open", "upcoming");

  private static final Set<String> TERMINAL_LABELS =
      Set.of(
          "cloture",
          "annule",
          "termine",
          "en_cours",
          "registration_closed",
          "cancelled",
          "canceled",
          "finished",
          "in_progress");

  private final WatchMetrics metrics;

  public ResourceStatus classify(long resourceId, RawStatusReading reading) {
    if (reading.restrictedActionAvailable()) {
      return ResourceStatus.OPEN_RESTRICTED;
    }
    if (reading.standardActionAvailable()) {
      return ResourceStatus.OPEN_STANDARD;
    }
    final String label = normalize(reading.label());
    if (TERMINAL_LABELS.contains(label)) {
      return ResourceStatus.TERMINAL;
    }
    if (UNOPENED_LABELS.contains(label)) {
      return ResourceStatus.UNOPENED;
    }
    metrics.recordClassificationAnomaly();
    logger.warn(
        "unrecognized status label; treating as unopened resourceId={} label={}",
        resourceId,
        reading.label());
    return ResourceStatus.UNOPENED;
  }

  // "Clôturé", "en cours" and "EN_COURS" all normalize to the same key
  static String normalize(String label) {
    if (label == null) {
      return "";
    }
    final String withoutAccents =
        Normalizer.normalize(label.trim(), Normalizer.Form.NFD).replaceAll("\\p{M}", "");
    return withoutAccents.toLowerCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
  }
}
