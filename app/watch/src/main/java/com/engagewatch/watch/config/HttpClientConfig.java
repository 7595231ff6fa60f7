/*
 * Where: Watch configuration
 * What: RestClient per downstream (page fetcher, account service, channel providers)
 * Why: Each downstream has its own base URL and transport timeouts
 */
package com.engagewatch.watch.config;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class HttpClientConfig {

  @Bean
  RestClient fetcherRestClient(RestClient.Builder builder, FetcherProperties properties) {
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory(properties.connectTimeout(), properties.readTimeout()))
        .build();
  }

  @Bean
  RestClient subscriberRestClient(
      RestClient.Builder builder, SubscriberDirectoryProperties properties) {
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory(properties.connectTimeout(), properties.readTimeout()))
        .build();
  }

  @Bean
  RestClient pushRestClient(RestClient.Builder builder, ChannelProperties properties) {
    return builder
        .baseUrl(properties.push().baseUrl())
        .requestFactory(requestFactory(properties.connectTimeout(), properties.readTimeout()))
        .build();
  }

  @Bean
  RestClient emailRestClient(RestClient.Builder builder, ChannelProperties properties) {
    return builder
        .baseUrl(properties.email().baseUrl())
        .requestFactory(requestFactory(properties.connectTimeout(), properties.readTimeout()))
        .build();
  }

  @Bean
  RestClient chatBotRestClient(RestClient.Builder builder, ChannelProperties properties) {
    return builder
        .baseUrl(properties.chatBot().baseUrl())
        .requestFactory(requestFactory(properties.connectTimeout(), properties.readTimeout()))
        .build();
  }

  private SimpleClientHttpRequestFactory requestFactory(
      Duration connectTimeout, Duration readTimeout) {
    final SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(connectTimeout);
    factory.setReadTimeout(readTimeout);
    return factory;
  }
}
