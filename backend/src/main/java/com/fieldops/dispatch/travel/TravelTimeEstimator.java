package com.fieldops.dispatch.travel;

import com.fieldops.dispatch.domain.GeoPoint;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Travel durations between two coordinates.
 *
 * <p>Routed results are cached per (origin cell, destination cell, departure bucket). When the provider cannot be
 * reached after the configured retries the estimator falls back to haversine distance times a detour factor at a
 * conservative speed and flags the result approximate. Approximate results are never cached.
 */
@Component
public class TravelTimeEstimator {
  private static final Logger log = LoggerFactory.getLogger(TravelTimeEstimator.class);

  private final RoutingProvider provider;
  private final RoutingProperties properties;
  private final Cache<CacheKey, Duration> cache;
  private final Retry retry;

  public TravelTimeEstimator(RoutingProvider provider, RoutingProperties properties) {
    this.provider = provider;
    this.properties = properties;
    this.cache = Caffeine.newBuilder()
        .maximumSize(properties.getCacheMaxSize())
        .expireAfterWrite(properties.getCacheTtl())
        .build();
    RetryConfig config = RetryConfig.custom()
        .maxAttempts(properties.getMaxAttempts())
        .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(properties.getInitialBackoffMs()), 2.0))
        .retryExceptions(RoutingProviderUnavailableException.class)
        .ignoreExceptions(RouteUnavailableException.class)
        .build();
    this.retry = Retry.of("routing-provider", config);
  }

  public TravelEstimate estimate(GeoPoint origin, GeoPoint destination, OffsetDateTime departure) {
    validate(origin, destination);
    if (sameCell(origin, destination)) {
      return TravelEstimate.routed(Duration.ZERO);
    }
    CacheKey key = new CacheKey(cell(origin), cell(destination), bucket(departure));
    Duration cached = cache.getIfPresent(key);
    if (cached != null) {
      return TravelEstimate.routed(cached);
    }
    TravelEstimate estimate = lookup(origin, destination, departure);
    if (!estimate.approximate()) {
      cache.put(key, estimate.duration());
    }
    return estimate;
  }

  /** Bypasses the cache; used for ETAs shown to customers. */
  public TravelEstimate estimateFresh(GeoPoint origin, GeoPoint destination, OffsetDateTime departure) {
    validate(origin, destination);
    if (sameCell(origin, destination)) {
      return TravelEstimate.routed(Duration.ZERO);
    }
    TravelEstimate estimate = lookup(origin, destination, departure);
    if (!estimate.approximate()) {
      cache.put(new CacheKey(cell(origin), cell(destination), bucket(departure)), estimate.duration());
    }
    return estimate;
  }

  public TravelEstimate straightLine(GeoPoint origin, GeoPoint destination) {
    validate(origin, destination);
    double km = origin.distanceKm(destination) * properties.getDetourFactor();
    long seconds = Math.round(km / properties.getFallbackSpeedKmh() * 3600.0);
    return TravelEstimate.fallback(Duration.ofSeconds(seconds));
  }

  long cachedEntries() {
    cache.cleanUp();
    return cache.estimatedSize();
  }

  private TravelEstimate lookup(GeoPoint origin, GeoPoint destination, OffsetDateTime departure) {
    try {
      Duration routed = Retry.decorateSupplier(retry, () -> provider.estimateTravel(origin, destination, departure)).get();
      return TravelEstimate.routed(routed);
    } catch (RoutingProviderUnavailableException ex) {
      log.warn("Routing provider unavailable after {} attempts, using straight-line estimate origin={} destination={} code={}",
          properties.getMaxAttempts(), origin, destination, ex.code());
      return straightLine(origin, destination);
    }
  }

  private void validate(GeoPoint origin, GeoPoint destination) {
    if (origin == null || destination == null || !origin.isValid() || !destination.isValid()) {
      throw new RouteUnavailableException("Invalid or missing coordinates.", origin, destination);
    }
  }

  private boolean sameCell(GeoPoint a, GeoPoint b) {
    return cell(a).equals(cell(b));
  }

  private String cell(GeoPoint p) {
    int scale = properties.getCellPrecision();
    return BigDecimal.valueOf(p.latitude()).setScale(scale, RoundingMode.HALF_UP).toPlainString()
        + "," + BigDecimal.valueOf(p.longitude()).setScale(scale, RoundingMode.HALF_UP).toPlainString();
  }

  private long bucket(OffsetDateTime departure) {
    long bucketSeconds = properties.getTimeBucketMinutes() * 60L;
    return departure == null ? 0 : Math.floorDiv(departure.toEpochSecond(), bucketSeconds);
  }

  private record CacheKey(String originCell, String destinationCell, long timeBucket) {}
}
