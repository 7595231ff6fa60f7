/*
 * Where: Watch domain model
 * What: Tier and channel addresses of one subscriber
 * Why: Dispatch needs to know which channels a subscriber can be reached on
 */
package com.engagewatch.watch.model;

import java.util.ArrayList;
import java.util.List;

public record SubscriberProfile(
    String subscriberId,
    ServiceTier tier,
    String pushPlayerId,
    boolean pushEnabled,
    String email,
    boolean emailEnabled,
    String chatId) {

  public List<ChannelType> enabledChannels() {
    final List<ChannelType> channels = new ArrayList<>();
    if (pushEnabled && hasText(pushPlayerId)) {
      channels.add(ChannelType.PUSH);
    }
    if (emailEnabled && hasText(email)) {
      channels.add(ChannelType.EMAIL);
    }
    if (hasText(chatId)) {
      channels.add(ChannelType.CHAT_BOT);
    }
    return List.copyOf(channels);
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
