package com.fieldops.dispatch.route;

import com.fieldops.dispatch.domain.GeoPoint;
import com.fieldops.dispatch.travel.TravelEstimate;

import java.time.OffsetDateTime;

@FunctionalInterface
public interface TravelTimes {
  TravelEstimate between(GeoPoint from, GeoPoint to, OffsetDateTime departure);
}
