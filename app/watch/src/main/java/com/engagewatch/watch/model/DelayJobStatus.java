package com.engagewatch.watch.model;

public enum DelayJobStatus {
  PENDING,
  PROCESSING,
  SENT,
  FAILED,
  CANCELLED
}
