/*
 * Where: Watch channel layer
 * What: A provider rejected or never received one message
 * Why: Dispatch records per-channel failures and decides retry on the aggregate
 */
package com.engagewatch.watch.channel;

import com.engagewatch.watch.model.ChannelType;

public class ChannelDeliveryException extends RuntimeException {

  private final ChannelType channel;

  public ChannelDeliveryException(ChannelType channel, String message) {
    super(message);
    this.channel = channel;
  }

  public ChannelDeliveryException(ChannelType channel, String message, Throwable cause) {
    super(message, cause);
    this.channel = channel;
  }

  public ChannelType channel() {
    return channel;
  }
}
