/*
 * Where: Watch client layer
 * What: Loads subscriber profiles from the account service and caches them briefly
 * Why: One opening fans out to many subscribers; the tier rarely changes within a minute
 */
package com.engagewatch.watch.client;

import com.engagewatch.watch.client.dto.SubscriberProfileResponse;
import com.engagewatch.watch.config.SubscriberDirectoryProperties;
import com.engagewatch.watch.model.ServiceTier;
import com.engagewatch.watch.model.SubscriberProfile;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Component
public class AccountSubscriberDirectory implements SubscriberDirectory {

  private static final Logger logger = LoggerFactory.getLogger(AccountSubscriberDirectory.class);

  private final RestClient subscriberRestClient;
  private final SubscriberDirectoryProperties properties;
  private final Cache<String, SubscriberProfile> cache;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component and cannot be copied")
  public AccountSubscriberDirectory(
      @Qualifier("subscriberRestClient") RestClient subscriberRestClient,
      SubscriberDirectoryProperties properties) {
    this.subscriberRestClient = subscriberRestClient;
    this.properties = properties;
    this.cache =
        CacheBuilder.newBuilder()
            .expireAfterWrite(properties.cacheTtl())
            .maximumSize(properties.cacheMaxSize())
            .build();
  }

  @Override
  public SubscriberProfile findProfile(String subscriberId) {
    if (subscriberId == null || subscriberId.isBlank()) {
      throw new IllegalArgumentException("subscriberId is required");
    }
    final SubscriberProfile cached = cache.getIfPresent(subscriberId);
    if (cached != null) {
      return cached;
    }
    final SubscriberProfile loaded = load(subscriberId);
    cache.put(subscriberId, loaded);
    return loaded;
  }

  private SubscriberProfile load(String subscriberId) {
    try {
      final SubscriberProfileResponse response =
          subscriberRestClient
              .get()
              .uri(properties.profilePath(), subscriberId)
              .retrieve()
              .body(SubscriberProfileResponse.class);
      return toProfile(subscriberId, response);
    } catch (RestClientResponseException ex) {
      throw mapResponseException(subscriberId, ex);
    } catch (ResourceAccessException ex) {
      if (HttpResourceStatusFetcher.isTimeout(ex)) {
        logger.warn("subscriber profile lookup timed out subscriberId={}", subscriberId);
        throw new SubscriberLookupException(
            SubscriberLookupException.Reason.TIMEOUT, "subscriber profile lookup timeout", ex);
      }
      logger.warn("subscriber profile lookup connection failed subscriberId={}", subscriberId, ex);
      throw new SubscriberLookupException(
          SubscriberLookupException.Reason.BAD_GATEWAY, "account service connection failed", ex);
    } catch (SubscriberLookupException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("subscriber profile parse failed subscriberId={}", subscriberId, ex);
      throw new SubscriberLookupException(
          SubscriberLookupException.Reason.INVALID_RESPONSE, "subscriber profile parse failed", ex);
    }
  }

  private SubscriberProfile toProfile(String subscriberId, SubscriberProfileResponse response) {
    if (response == null) {
      throw new SubscriberLookupException(
          SubscriberLookupException.Reason.INVALID_RESPONSE, "subscriber profile is empty");
    }
    final ServiceTier tier = ServiceTier.parse(response.tier());
    if (tier == null) {
      throw new SubscriberLookupException(
          SubscriberLookupException.Reason.INVALID_RESPONSE,
          "subscriber profile has unknown tier " + response.tier());
    }
    return new SubscriberProfile(
        subscriberId,
        tier,
        response.pushPlayerId(),
        Boolean.TRUE.equals(response.pushEnabled()),
        response.email(),
        Boolean.TRUE.equals(response.emailEnabled()),
        response.chatId());
  }

  private SubscriberLookupException mapResponseException(
      String subscriberId, RestClientResponseException ex) {
    logger.warn(
        "subscriber profile lookup failed subscriberId={} status={} statusText={}",
        subscriberId,
        ex.getStatusCode().value(),
        ex.getStatusText());
    if (ex.getStatusCode().value() == 404) {
      return new SubscriberLookupException(
          SubscriberLookupException.Reason.NOT_FOUND, "subscriber not found", ex);
    }
    return new SubscriberLookupException(
        SubscriberLookupException.Reason.BAD_GATEWAY, "account service request failed", ex);
  }
}
