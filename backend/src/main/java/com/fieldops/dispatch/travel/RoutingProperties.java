package com.fieldops.dispatch.travel;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app.routing")
public class RoutingProperties {
  private static final Duration MIN_TTL = Duration.ofMinutes(5);
  private static final Duration MAX_TTL = Duration.ofMinutes(15);

  private String baseUrl = "";
  private String apiKey = "";
  private long connectTimeoutMs = 2000;
  private long readTimeoutMs = 5000;
  private Duration cacheTtl = Duration.ofMinutes(10);
  private long cacheMaxSize = 10_000;
  /** Decimal places kept when snapping coordinates to a cache cell; 3 is roughly 110 m. */
  private int cellPrecision = 3;
  private int timeBucketMinutes = 15;
  private int maxAttempts = 3;
  private long initialBackoffMs = 200;
  private double fallbackSpeedKmh = 40.0;
  private double detourFactor = 1.3;

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl == null ? "" : baseUrl.trim();
  }

  public String getApiKey() {
    return apiKey;
  }

  public void setApiKey(String apiKey) {
    this.apiKey = apiKey == null ? "" : apiKey;
  }

  public long getConnectTimeoutMs() {
    return connectTimeoutMs;
  }

  public void setConnectTimeoutMs(long connectTimeoutMs) {
    this.connectTimeoutMs = connectTimeoutMs;
  }

  public long getReadTimeoutMs() {
    return readTimeoutMs;
  }

  public void setReadTimeoutMs(long readTimeoutMs) {
    this.readTimeoutMs = readTimeoutMs;
  }

  public Duration getCacheTtl() {
    return cacheTtl;
  }

  public void setCacheTtl(Duration cacheTtl) {
    if (cacheTtl == null || cacheTtl.compareTo(MIN_TTL) < 0 || cacheTtl.compareTo(MAX_TTL) > 0) {
      throw new IllegalArgumentException("app.routing.cache-ttl must be between 5 and 15 minutes, got " + cacheTtl);
    }
    this.cacheTtl = cacheTtl;
  }

  public long getCacheMaxSize() {
    return cacheMaxSize;
  }

  public void setCacheMaxSize(long cacheMaxSize) {
    this.cacheMaxSize = cacheMaxSize;
  }

  public int getCellPrecision() {
    return cellPrecision;
  }

  public void setCellPrecision(int cellPrecision) {
    this.cellPrecision = cellPrecision;
  }

  public int getTimeBucketMinutes() {
    return timeBucketMinutes;
  }

  public void setTimeBucketMinutes(int timeBucketMinutes) {
    this.timeBucketMinutes = Math.max(1, timeBucketMinutes);
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public void setMaxAttempts(int maxAttempts) {
    this.maxAttempts = Math.max(1, maxAttempts);
  }

  public long getInitialBackoffMs() {
    return initialBackoffMs;
  }

  public void setInitialBackoffMs(long initialBackoffMs) {
    this.initialBackoffMs = Math.max(1, initialBackoffMs);
  }

  public double getFallbackSpeedKmh() {
    return fallbackSpeedKmh;
  }

  public void setFallbackSpeedKmh(double fallbackSpeedKmh) {
    this.fallbackSpeedKmh = fallbackSpeedKmh;
  }

  public double getDetourFactor() {
    return detourFactor;
  }

  public void setDetourFactor(double detourFactor) {
    this.detourFactor = detourFactor;
  }
}
