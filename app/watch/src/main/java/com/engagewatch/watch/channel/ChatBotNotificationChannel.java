/*
 * Where: Watch channel layer
 * What: Chat-bot delivery through the Telegram Bot API sendMessage call
 */
package com.engagewatch.watch.channel;

import com.engagewatch.watch.config.ChannelProperties;
import com.engagewatch.watch.model.ChannelType;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
@ConditionalOnProperty(name = "watch.channels.chat-bot.enabled", havingValue = "true")
public class ChatBotNotificationChannel extends HttpNotificationChannel {

  private final ChannelProperties.ChatBot properties;
  private final NotificationMessageFormatter formatter;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component and cannot be copied")
  public ChatBotNotificationChannel(
      @Qualifier("chatBotRestClient") RestClient chatBotRestClient,
      ChannelProperties properties,
      NotificationMessageFormatter formatter) {
    super(chatBotRestClient);
    this.properties = properties.chatBot();
    this.formatter = formatter;
  }

  @Override
  public ChannelType type() {
    return ChannelType.CHAT_BOT;
  }

  @Override
  public void deliver(DeliveryRequest request) {
    final NotificationMessage message = formatter.format(request);
    send(request.profile().chatId(), message.html(), "HTML");
  }

  /** Posts a plain-text message, used for operator alerts outside the subscriber flow. */
  public void sendText(String chatId, String text) {
    send(chatId, text, null);
  }

  private void send(String chatId, String text, String parseMode) {
    final String token = requireText(type(), properties.botToken(), "chat-bot token");
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("chat_id", chatId);
    body.put("text", text);
    if (parseMode != null) {
      body.put("parse_mode", parseMode);
    }
    body.put("disable_web_page_preview", true);
    // bot token is a path segment
    post("/bot{token}/sendMessage", body, headers -> {}, token);
  }
}
