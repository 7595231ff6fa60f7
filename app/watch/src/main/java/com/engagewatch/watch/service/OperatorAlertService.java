/*
 * Where: Watch service layer
 * What: Sends operator alerts to the admin chat through the chat-bot channel
 * Why: A halted worker or a permanently failed delivery needs a human, not only a log line
 */
package com.engagewatch.watch.service;

import com.engagewatch.watch.channel.ChannelDeliveryException;
import com.engagewatch.watch.channel.ChatBotNotificationChannel;
import com.engagewatch.watch.config.AlertProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

@Service
public class OperatorAlertService {

  private static final Logger logger = LoggerFactory.getLogger(OperatorAlertService.class);

  private final AlertProperties properties;
  private final ObjectProvider<ChatBotNotificationChannel> chatBot;

  public OperatorAlertService(
      AlertProperties properties, ObjectProvider<ChatBotNotificationChannel> chatBot) {
    this.properties = properties;
    this.chatBot = chatBot;
  }

  public int failureThreshold() {
    return properties.failureThreshold();
  }

  @EventListener(ApplicationReadyEvent.class)
  public void announceStartup() {
    send("watch started; polling and dispatch are running");
  }

  /**
   * Sends one alert. Returns false when no admin chat is configured or the chat-bot rejected
   * the message; the alert is logged either way.
   */
  public boolean alert(String text) {
    logger.warn("operator alert text={}", text);
    return send(text);
  }

  private boolean send(String text) {
    if (!properties.hasDestination()) {
      return false;
    }
    final ChatBotNotificationChannel channel = chatBot.getIfAvailable();
    if (channel == null) {
      logger.warn("operator alert not sent because the chat-bot channel is disabled");
      return false;
    }
    try {
      channel.sendText(properties.chatId(), text);
      return true;
    } catch (ChannelDeliveryException ex) {
      logger.error("operator alert delivery failed message={}", ex.getMessage(), ex);
      return false;
    }
  }
}
