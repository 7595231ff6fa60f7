/*
 * Where: Watch configuration binding
 * What: Provider endpoints and credentials for push, email and chat-bot delivery
 * Why: Each channel is switched on per environment with its own secrets
 */
package com.engagewatch.watch.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "watch.channels")
public record ChannelProperties(
    Duration connectTimeout,
    Duration readTimeout,
    String resourceLinkTemplate,
    Push push,
    Email email,
    ChatBot chatBot) {

  public ChannelProperties {
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
    resourceLinkTemplate =
        resourceLinkTemplate == null || resourceLinkTemplate.isBlank()
            ? "https://www.ffe.com/concours/{resourceId}"
            : resourceLinkTemplate;
    push = push == null ? new Push(false, null, null, null) : push;
    email = email == null ? new Email(false, null, null, null) : email;
    chatBot = chatBot == null ? new ChatBot(false, null, null) : chatBot;
  }

  /** OneSignal REST settings. */
  public record Push(boolean enabled, String baseUrl, String appId, String apiKey) {
    public Push {
      baseUrl = baseUrl == null ? "https://onesignal.com" : baseUrl;
    }
  }

  /** Resend REST settings. */
  public record Email(boolean enabled, String baseUrl, String apiKey, String fromAddress) {
    public Email {
      baseUrl = baseUrl == null ? "https://api.resend.com" : baseUrl;
      fromAddress = fromAddress == null ? "EngageWatch <alerts@engagewatch.local>" : fromAddress;
    }
  }

  /** Telegram Bot API settings. */
  public record ChatBot(boolean enabled, String baseUrl, String botToken) {
    public ChatBot {
      baseUrl = baseUrl == null ? "https://api.telegram.org" : baseUrl;
    }
  }
}
