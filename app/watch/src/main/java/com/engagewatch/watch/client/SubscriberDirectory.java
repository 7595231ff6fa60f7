package com.engagewatch.watch.client;

import com.engagewatch.watch.model.ServiceTier;
import com.engagewatch.watch.model.SubscriberProfile;

/** Subscriber tier and channel addresses, owned by the account service. */
public interface SubscriberDirectory extends TierLookup {

  /** @throws SubscriberLookupException when the profile cannot be loaded */
  SubscriberProfile findProfile(String subscriberId);

  @Override
  default ServiceTier tierOf(String subscriberId) {
    return findProfile(subscriberId).tier();
  }
}
