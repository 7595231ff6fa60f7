/*
 * Where: Watch client layer
 * What: Reads resource page indicators from the fetcher service over HTTP
 * Why: The authenticated page scraping lives outside this service
 */
package com.engagewatch.watch.client;

import com.engagewatch.watch.client.dto.ResourceStatusResponse;
import com.engagewatch.watch.config.FetcherProperties;
import com.engagewatch.watch.model.RawStatusReading;
import com.engagewatch.watch.model.ResourceMetadata;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Component
public class HttpResourceStatusFetcher implements ResourceStatusFetcher {

  private static final Logger logger = LoggerFactory.getLogger(HttpResourceStatusFetcher.class);

  private final RestClient fetcherRestClient;
  private final FetcherProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component and cannot be copied")
  public HttpResourceStatusFetcher(
      @Qualifier("fetcherRestClient") RestClient fetcherRestClient, FetcherProperties properties) {
    this.fetcherRestClient = fetcherRestClient;
    this.properties = properties;
  }

  @Override
  public RawStatusReading fetch(long resourceId) {
    try {
      final ResourceStatusResponse response =
          fetcherRestClient
              .get()
              .uri(properties.statusPath(), resourceId)
              .retrieve()
              .body(ResourceStatusResponse.class);
      return toReading(resourceId, response);
    } catch (RestClientResponseException ex) {
      throw mapResponseException(resourceId, ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(resourceId, ex);
    } catch (ResourceFetchException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("fetcher response parse failed resourceId={}", resourceId, ex);
      throw new ResourceFetchException(
          ResourceFetchException.Reason.INVALID_RESPONSE, "fetcher response parse failed", ex);
    }
  }

  private RawStatusReading toReading(long resourceId, ResourceStatusResponse response) {
    if (response == null
        || response.restrictedActionAvailable() == null
        || response.standardActionAvailable() == null) {
      throw new ResourceFetchException(
          ResourceFetchException.Reason.INVALID_RESPONSE,
          "fetcher response is missing indicators for resource " + resourceId);
    }
    return new RawStatusReading(
        response.restrictedActionAvailable(),
        response.standardActionAvailable(),
        response.statusLabel(),
        new ResourceMetadata(
            response.name(), response.location(), response.startDate(), response.endDate()));
  }

  private ResourceFetchException mapResponseException(
      long resourceId, RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "fetcher request failed resourceId={} status={} statusText={}",
        resourceId,
        status,
        ex.getStatusText());
    if (status == 404) {
      return new ResourceFetchException(
          ResourceFetchException.Reason.NOT_FOUND, "resource page not found", ex);
    }
    if (status == 401 || status == 403) {
      return new ResourceFetchException(
          ResourceFetchException.Reason.AUTH_EXPIRED, "fetcher session rejected", ex);
    }
    return new ResourceFetchException(
        ResourceFetchException.Reason.UNAVAILABLE, "fetcher request failed", ex);
  }

  private ResourceFetchException mapResourceException(
      long resourceId, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("fetcher request timed out resourceId={}", resourceId);
      return new ResourceFetchException(
          ResourceFetchException.Reason.TIMEOUT, "fetcher request timeout", ex);
    }
    logger.warn("fetcher connection failed resourceId={}", resourceId, ex);
    return new ResourceFetchException(
        ResourceFetchException.Reason.UNAVAILABLE, "fetcher connection failed", ex);
  }

  static boolean isTimeout(Throwable ex) {
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
