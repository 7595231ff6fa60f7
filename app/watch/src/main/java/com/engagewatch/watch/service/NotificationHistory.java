package com.engagewatch.watch.service;

import com.engagewatch.watch.model.DeliveryFailureRecord;
import com.engagewatch.watch.model.NotificationLogEntry;
import java.util.List;

public record NotificationHistory(
    List<NotificationLogEntry> entries, List<DeliveryFailureRecord> failures) {

  public NotificationHistory {
    entries = List.copyOf(entries);
    failures = List.copyOf(failures);
  }
}
