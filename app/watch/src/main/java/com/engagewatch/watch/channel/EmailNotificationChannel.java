/*
 * Where: Watch channel layer
 * What: Email delivery through the Resend REST API
 */
package com.engagewatch.watch.channel;

import com.engagewatch.watch.config.ChannelProperties;
import com.engagewatch.watch.model.ChannelType;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
@ConditionalOnProperty(name = "watch.channels.email.enabled", havingValue = "true")
public class EmailNotificationChannel extends HttpNotificationChannel {

  private final ChannelProperties.Email properties;
  private final NotificationMessageFormatter formatter;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component and cannot be copied")
  public EmailNotificationChannel(
      @Qualifier("emailRestClient") RestClient emailRestClient,
      ChannelProperties properties,
      NotificationMessageFormatter formatter) {
    super(emailRestClient);
    this.properties = properties.email();
    this.formatter = formatter;
  }

  @Override
  public ChannelType type() {
    return ChannelType.EMAIL;
  }

  @Override
  public void deliver(DeliveryRequest request) {
    final String apiKey = requireText(type(), properties.apiKey(), "email api key");
    final NotificationMessage message = formatter.format(request);
    final Map<String, Object> body =
        Map.of(
            "from", properties.fromAddress(),
            "to", List.of(request.profile().email()),
            "subject", message.title(),
            "html", message.html().replace("\n", "<br>"));
    post("/emails", body, headers -> headers.setBearerAuth(apiKey));
  }
}
