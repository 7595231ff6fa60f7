package com.engagewatch.watch.channel;

import com.engagewatch.watch.model.ChannelType;
import com.engagewatch.watch.model.SubscriberProfile;

/** One outbound delivery channel. Implementations are enabled per environment. */
public interface NotificationChannel {

  ChannelType type();

  default boolean isAvailableFor(SubscriberProfile profile) {
    return profile.enabledChannels().contains(type());
  }

  /** @throws ChannelDeliveryException when the provider did not accept the message */
  void deliver(DeliveryRequest request);
}
