package com.fieldops.dispatch.travel;

import com.fieldops.dispatch.domain.GeoPoint;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * External routing engine.
 *
 * <p>Implementations throw {@link RouteUnavailableException} when the provider answers that no route exists and
 * {@link RoutingProviderUnavailableException} when the provider cannot be reached.
 */
public interface RoutingProvider {
  Duration estimateTravel(GeoPoint origin, GeoPoint destination, OffsetDateTime departure);
}
