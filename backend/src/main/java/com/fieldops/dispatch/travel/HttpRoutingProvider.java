package com.fieldops.dispatch.travel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldops.dispatch.domain.GeoPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.netty.http.client.HttpClient;

import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.concurrent.TimeoutException;

/**
 * Routing provider reached over HTTP: {@code GET {base}/v1/travel-time?origin=lat,lng&destination=lat,lng&departure=iso}
 * answering {@code {"durationSeconds": n}}. 404 and 422 mean no route between the points.
 */
@Component
public class HttpRoutingProvider implements RoutingProvider {
  private static final Logger log = LoggerFactory.getLogger(HttpRoutingProvider.class);
  private static final String TRAVEL_TIME_PATH = "/v1/travel-time";

  private final RoutingProperties properties;
  private final ObjectMapper objectMapper;
  private volatile WebClient webClient;

  public HttpRoutingProvider(RoutingProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public Duration estimateTravel(GeoPoint origin, GeoPoint destination, OffsetDateTime departure) {
    if (!StringUtils.hasText(properties.getBaseUrl())) {
      throw new RoutingProviderUnavailableException("Routing provider is not configured.", "BASE_URL_MISSING");
    }
    RoutingHttpResult result = execute(origin, destination, departure);
    if (result.status() == 404 || result.status() == 422) {
      throw new RouteUnavailableException("Routing provider found no route between the points.", origin, destination);
    }
    if (result.status() < 200 || result.status() >= 300) {
      log.warn("Routing provider answered status={} origin={} destination={}", result.status(), origin, destination);
      throw new RoutingProviderUnavailableException("Routing provider answered HTTP " + result.status() + ".", "HTTP_" + result.status());
    }
    return parseDuration(result.body());
  }

  private RoutingHttpResult execute(GeoPoint origin, GeoPoint destination, OffsetDateTime departure) {
    Duration readTimeout = Duration.ofMillis(properties.getReadTimeoutMs());
    try {
      return client()
          .get()
          .uri(u -> u.path(TRAVEL_TIME_PATH)
              .queryParam("origin", origin.toString())
              .queryParam("destination", destination.toString())
              .queryParam("departure", departure.toString())
              .build())
          .headers(h -> {
            if (StringUtils.hasText(properties.getApiKey())) {
              h.set("X-Api-Key", properties.getApiKey());
            }
          })
          .exchangeToMono(resp -> resp.bodyToMono(String.class).defaultIfEmpty("").map(body -> new RoutingHttpResult(resp.statusCode().value(), body)))
          .timeout(readTimeout)
          .blockOptional()
          .orElse(new RoutingHttpResult(0, ""));
    } catch (Exception ex) {
      throw mapClientException(ex);
    }
  }

  private Duration parseDuration(String body) {
    try {
      JsonNode node = objectMapper.readTree(body);
      JsonNode seconds = node == null ? null : node.get("durationSeconds");
      if (seconds == null || !seconds.isNumber() || seconds.asDouble() < 0) {
        throw new RoutingProviderUnavailableException("Routing provider response has no durationSeconds.", "MALFORMED_RESPONSE");
      }
      return Duration.ofMillis(Math.round(seconds.asDouble() * 1000));
    } catch (IOException ex) {
      throw new RoutingProviderUnavailableException("Routing provider response is not JSON.", "MALFORMED_RESPONSE");
    }
  }

  private WebClient client() {
    WebClient current = webClient;
    if (current == null) {
      var httpClient = HttpClient.create()
          .option(io.netty.channel.ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.toIntExact(properties.getConnectTimeoutMs()))
          .responseTimeout(Duration.ofMillis(properties.getReadTimeoutMs()));
      current = WebClient.builder()
          .baseUrl(properties.getBaseUrl())
          .clientConnector(new ReactorClientHttpConnector(httpClient))
          .build();
      webClient = current;
    }
    return current;
  }

  private RuntimeException mapClientException(Exception ex) {
    Throwable root = Exceptions.unwrap(ex);
    for (Throwable t = root; t != null; t = t.getCause()) {
      if (t instanceof TimeoutException || t instanceof io.netty.handler.timeout.TimeoutException) {
        return new RoutingProviderUnavailableException("Routing provider did not answer in time.", "TimeoutException");
      }
      if (t instanceof ConnectException || t instanceof UnknownHostException) {
        return new RoutingProviderUnavailableException("Could not connect to the routing provider.", t.getClass().getSimpleName());
      }
    }
    if (root instanceof WebClientRequestException || root instanceof IOException) {
      return new RoutingProviderUnavailableException("Routing provider request failed: " + root.getMessage(), root.getClass().getSimpleName());
    }
    return new RuntimeException(root.getMessage(), root);
  }

  private record RoutingHttpResult(int status, String body) {}
}
