/*
 * Where: Watch client layer
 * What: Failure to read a resource page
 * Why: Poller applies backoff and logs the reason without touching stored status
 */
package com.engagewatch.watch.client;

public class ResourceFetchException extends RuntimeException {

  public enum Reason {
    TIMEOUT,
    AUTH_EXPIRED,
    NOT_FOUND,
    UNAVAILABLE,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public ResourceFetchException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public ResourceFetchException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
