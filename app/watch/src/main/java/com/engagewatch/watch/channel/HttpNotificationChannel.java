/*
 * Where: Watch channel layer
 * What: Shared POST and error mapping for REST-based providers
 * Why: Every provider failure must surface as a ChannelDeliveryException for its channel
 */
package com.engagewatch.watch.channel;

import com.engagewatch.watch.model.ChannelType;
import java.net.SocketTimeoutException;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

abstract class HttpNotificationChannel implements NotificationChannel {

  private static final Logger logger = LoggerFactory.getLogger(HttpNotificationChannel.class);

  private final RestClient restClient;

  protected HttpNotificationChannel(RestClient restClient) {
    this.restClient = restClient;
  }

  protected void post(String uri, Object body, Consumer<HttpHeaders> headers, Object... uriVars) {
    final ChannelType channel = type();
    try {
      restClient
          .post()
          .uri(uri, uriVars)
          .contentType(MediaType.APPLICATION_JSON)
          .headers(headers)
          .body(body)
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientResponseException ex) {
      logger.warn(
          "channel provider rejected message channel={} status={} statusText={}",
          channel,
          ex.getStatusCode().value(),
          ex.getStatusText());
      throw new ChannelDeliveryException(
          channel, channel + " provider returned " + ex.getStatusCode().value(), ex);
    } catch (ResourceAccessException ex) {
      final String problem = isTimeout(ex) ? "timeout" : "connection failed";
      logger.warn("channel provider unreachable channel={} problem={}", channel, problem);
      throw new ChannelDeliveryException(channel, channel + " provider " + problem, ex);
    } catch (RestClientException ex) {
      throw new ChannelDeliveryException(channel, channel + " request failed", ex);
    }
  }

  protected static String requireText(ChannelType channel, String value, String name) {
    if (value == null || value.isBlank()) {
      throw new ChannelDeliveryException(channel, name + " is not configured");
    }
    return value;
  }

  private static boolean isTimeout(Throwable ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
