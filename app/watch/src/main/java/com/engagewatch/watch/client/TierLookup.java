package com.engagewatch.watch.client;

import com.engagewatch.watch.model.ServiceTier;

public interface TierLookup {

  /** @throws SubscriberLookupException when the tier cannot be determined */
  ServiceTier tierOf(String subscriberId);
}
