package com.engagewatch.watch.model;

public enum OpeningEventStatus {
  PENDING,
  PROCESSING,
  DONE
}
