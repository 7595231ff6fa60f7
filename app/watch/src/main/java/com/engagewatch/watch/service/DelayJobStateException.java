package com.engagewatch.watch.service;

/** The delay job exists but is not in a state that allows the requested operation. */
public class DelayJobStateException extends RuntimeException {

  public DelayJobStateException(String message) {
    super(message);
  }
}
