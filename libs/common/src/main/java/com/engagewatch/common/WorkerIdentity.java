/*
 * Where: shared utilities
 * What: resolves the lock owner name written into locked_by columns
 * Why: every claiming worker in a process reports the same owner, distinct from other processes
 *      on the same host
 */
package com.engagewatch.common;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class WorkerIdentity {

  private static final Logger logger = LoggerFactory.getLogger(WorkerIdentity.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  private final String lockedBy;

  public WorkerIdentity(String lockedBy) {
    if (lockedBy == null || lockedBy.isBlank()) {
      throw new IllegalArgumentException("lockedBy is required");
    }
    this.lockedBy = lockedBy;
  }

  /** Owner in {@code host:pid} form. */
  public static WorkerIdentity fromEnvironment() {
    return new WorkerIdentity(
        ownerName(resolveHostname(System.getenv(HOSTNAME_ENV)), ProcessHandle.current().pid()));
  }

  static String ownerName(String hostname, long pid) {
    return hostname + ":" + pid;
  }

  static String resolveHostname(String env) {
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }

  public String lockedBy() {
    return lockedBy;
  }

  /** Owner value unique to one claim, for leases not shared by threads of one process. */
  public String newLeaseToken() {
    return lockedBy + "/" + UUID.randomUUID();
  }

  @Override
  public String toString() {
    return lockedBy;
  }
}
