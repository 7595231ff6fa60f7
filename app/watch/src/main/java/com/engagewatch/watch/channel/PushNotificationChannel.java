/*
 * Where: Watch channel layer
 * What: Web/mobile push through the OneSignal REST API
 * Why: Push is the fastest channel for subscribers who opted in on a device
 */
package com.engagewatch.watch.channel;

import com.engagewatch.watch.config.ChannelProperties;
import com.engagewatch.watch.model.ChannelType;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
@ConditionalOnProperty(name = "watch.channels.push.enabled", havingValue = "true")
public class PushNotificationChannel extends HttpNotificationChannel {

  private final ChannelProperties.Push properties;
  private final NotificationMessageFormatter formatter;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component and cannot be copied")
  public PushNotificationChannel(
      @Qualifier("pushRestClient") RestClient pushRestClient,
      ChannelProperties properties,
      NotificationMessageFormatter formatter) {
    super(pushRestClient);
    this.properties = properties.push();
    this.formatter = formatter;
  }

  @Override
  public ChannelType type() {
    return ChannelType.PUSH;
  }

  @Override
  public void deliver(DeliveryRequest request) {
    final String appId = requireText(type(), properties.appId(), "push app id");
    final String apiKey = requireText(type(), properties.apiKey(), "push api key");
    final NotificationMessage message = formatter.format(request);
    final Map<String, Object> body =
        Map.of(
            "app_id", appId,
            "include_player_ids", List.of(request.profile().pushPlayerId()),
            "headings", Map.of("en", message.title()),
            "contents", Map.of("en", message.text()),
            "url", message.link());
    post(
        "/api/v1/notifications",
        body,
        headers -> headers.set(HttpHeaders.AUTHORIZATION, "Basic " + apiKey));
  }
}
