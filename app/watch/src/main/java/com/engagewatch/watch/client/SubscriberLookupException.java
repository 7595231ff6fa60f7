/*
 * Where: Watch client layer
 * What: Failure to load a subscriber profile from the account service
 * Why: Fan-out falls back to the default tier; dispatch counts it as a failed attempt
 */
package com.engagewatch.watch.client;

public class SubscriberLookupException extends RuntimeException {

  public enum Reason {
    NOT_FOUND,
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final Reason reason;

  public SubscriberLookupException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public SubscriberLookupException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
