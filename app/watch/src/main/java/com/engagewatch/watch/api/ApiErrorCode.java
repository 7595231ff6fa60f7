package com.engagewatch.watch.api;

/** Distinguishes error causes that share an HTTP status. */
public enum ApiErrorCode {
  BAD_REQUEST,
  NOT_FOUND,
  DELAY_JOB_STATE_CONFLICT
}
