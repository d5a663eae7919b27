package com.fieldops.dispatch.travel;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldops.dispatch.domain.GeoPoint;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpRoutingProviderTest {
  private static final GeoPoint ORIGIN = new GeoPoint(40.7, -74.0);
  private static final GeoPoint DESTINATION = new GeoPoint(40.75, -73.95);
  private static final OffsetDateTime DEPARTURE = OffsetDateTime.of(2026, 3, 10, 9, 0, 0, 0, ZoneOffset.UTC);

  private HttpServer server;

  @AfterEach
  void tearDown() {
    if (server != null) {
      server.stop(0);
    }
  }

  @Test
  void parsesDurationAndSendsPointsAndApiKey() throws Exception {
    AtomicReference<String> query = new AtomicReference<>("");
    AtomicReference<String> apiKey = new AtomicReference<>("");
    start(200, "{\"durationSeconds\": 630}", query, apiKey);

    HttpRoutingProvider provider = new HttpRoutingProvider(properties(), new ObjectMapper());
    Duration duration = provider.estimateTravel(ORIGIN, DESTINATION, DEPARTURE);

    assertEquals(Duration.ofSeconds(630), duration);
    String decoded = URLDecoder.decode(query.get(), StandardCharsets.UTF_8);
    assertTrue(decoded.contains("origin=40.7,-74.0"), decoded);
    assertTrue(decoded.contains("destination=40.75,-73.95"), decoded);
    assertEquals("secret-key", apiKey.get());
  }

  @Test
  void notFoundMeansNoRoute() throws Exception {
    start(404, "{}", new AtomicReference<>(), new AtomicReference<>());

    HttpRoutingProvider provider = new HttpRoutingProvider(properties(), new ObjectMapper());

    assertThrows(RouteUnavailableException.class, () -> provider.estimateTravel(ORIGIN, DESTINATION, DEPARTURE));
  }

  @Test
  void serverErrorMeansProviderUnavailable() throws Exception {
    start(503, "busy", new AtomicReference<>(), new AtomicReference<>());

    HttpRoutingProvider provider = new HttpRoutingProvider(properties(), new ObjectMapper());
    RoutingProviderUnavailableException ex = assertThrows(RoutingProviderUnavailableException.class,
        () -> provider.estimateTravel(ORIGIN, DESTINATION, DEPARTURE));

    assertEquals("HTTP_503", ex.details().orElseThrow().get("cause"));
  }

  @Test
  void malformedBodyMeansProviderUnavailable() throws Exception {
    start(200, "{\"meters\": 12}", new AtomicReference<>(), new AtomicReference<>());

    HttpRoutingProvider provider = new HttpRoutingProvider(properties(), new ObjectMapper());
    RoutingProviderUnavailableException ex = assertThrows(RoutingProviderUnavailableException.class,
        () -> provider.estimateTravel(ORIGIN, DESTINATION, DEPARTURE));

    assertEquals("MALFORMED_RESPONSE", ex.details().orElseThrow().get("cause"));
  }

  @Test
  void refusedConnectionMeansProviderUnavailable() throws Exception {
    HttpServer closed = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    int port = closed.getAddress().getPort();
    closed.stop(0);

    RoutingProperties props = new RoutingProperties();
    props.setBaseUrl("http://127.0.0.1:" + port);
    props.setConnectTimeoutMs(1000);
    props.setReadTimeoutMs(2000);
    HttpRoutingProvider provider = new HttpRoutingProvider(props, new ObjectMapper());

    assertThrows(RoutingProviderUnavailableException.class, () -> provider.estimateTravel(ORIGIN, DESTINATION, DEPARTURE));
  }

  @Test
  void missingBaseUrlMeansProviderUnavailable() {
    HttpRoutingProvider provider = new HttpRoutingProvider(new RoutingProperties(), new ObjectMapper());
    RoutingProviderUnavailableException ex = assertThrows(RoutingProviderUnavailableException.class,
        () -> provider.estimateTravel(ORIGIN, DESTINATION, DEPARTURE));

    assertEquals("BASE_URL_MISSING", ex.details().orElseThrow().get("cause"));
  }

  private void start(int status, String body, AtomicReference<String> query, AtomicReference<String> apiKey) throws Exception {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/v1/travel-time", exchange -> {
      query.set(exchange.getRequestURI().getRawQuery());
      apiKey.set(exchange.getRequestHeaders().getFirst("X-Api-Key"));
      byte[] response = body.getBytes(StandardCharsets.UTF_8);
      exchange.getResponseHeaders().add("Content-Type", "application/json");
      exchange.sendResponseHeaders(status, response.length);
      try (OutputStream os = exchange.getResponseBody()) {
        os.write(response);
      }
    });
    server.start();
  }

  private RoutingProperties properties() {
    RoutingProperties props = new RoutingProperties();
    props.setBaseUrl("http://127.0.0.1:" + server.getAddress().getPort());
    props.setApiKey("secret-key");
    props.setReadTimeoutMs(3000);
    return props;
  }
}
