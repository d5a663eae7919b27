package com.fieldops.dispatch.sync;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app.sync")
public class SyncProperties {
  private int maxAttempts = 5;
  private Duration initialBackoff = Duration.ofSeconds(1);
  private double backoffMultiplier = 2.0;
  private int maxBatchSize = 500;

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public void setMaxAttempts(int maxAttempts) {
    this.maxAttempts = Math.max(1, maxAttempts);
  }

  public Duration getInitialBackoff() {
    return initialBackoff;
  }

  public void setInitialBackoff(Duration initialBackoff) {
    this.initialBackoff = initialBackoff;
  }

  public double getBackoffMultiplier() {
    return backoffMultiplier;
  }

  public void setBackoffMultiplier(double backoffMultiplier) {
    this.backoffMultiplier = backoffMultiplier;
  }

  public int getMaxBatchSize() {
    return maxBatchSize;
  }

  public void setMaxBatchSize(int maxBatchSize) {
    this.maxBatchSize = maxBatchSize;
  }

  /** Delay before retry number {@code attempts + 1}. */
  public Duration backoffAfter(int attempts) {
    double factor = Math.pow(backoffMultiplier, Math.max(0, attempts - 1));
    return Duration.ofMillis(Math.round(initialBackoff.toMillis() * factor));
  }
}
