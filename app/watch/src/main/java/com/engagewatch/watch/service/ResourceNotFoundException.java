package com.engagewatch.watch.service;

import java.util.UUID;

public class ResourceNotFoundException extends RuntimeException {

  public ResourceNotFoundException(String message) {
    super(message);
  }

  public static ResourceNotFoundException resource(long resourceId) {
    return new ResourceNotFoundException("resource " + resourceId + " is not tracked");
  }

  public static ResourceNotFoundException delayJob(UUID jobId) {
    return new ResourceNotFoundException("delay job " + jobId + " does not exist");
  }
}
