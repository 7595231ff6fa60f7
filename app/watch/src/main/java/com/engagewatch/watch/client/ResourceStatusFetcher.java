package com.engagewatch.watch.client;

import com.engagewatch.watch.model.RawStatusReading;

/** Reads the current registration indicators of one resource page. */
public interface ResourceStatusFetcher {

  /**
   * @throws ResourceFetchException when the page could not be read; the caller keeps the stored
   *     status and retries later
   */
  RawStatusReading fetch(long resourceId);
}
