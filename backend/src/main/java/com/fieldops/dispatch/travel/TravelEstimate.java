package com.fieldops.dispatch.travel;

import java.time.Duration;

/**
 * Point-to-point travel duration. {@code approximate} marks a straight-line fallback rather than a routed estimate.
 */
public record TravelEstimate(Duration duration, boolean approximate) {
  public static TravelEstimate routed(Duration duration) {
    return new TravelEstimate(duration, false);
  }

  public static TravelEstimate fallback(Duration duration) {
    return new TravelEstimate(duration, true);
  }

  public double minutes() {
    return duration.toMillis() / 60000.0;
  }
}
