package com.fieldops.dispatch.domain;

/**
 * WGS84 coordinate in decimal degrees.
 */
public record GeoPoint(double latitude, double longitude) {
  private static final double EARTH_RADIUS_KM = 6371.0;

  public static GeoPoint ofNullable(Double latitude, Double longitude) {
    if (latitude == null || longitude == null) {
      return null;
    }
    return new GeoPoint(latitude, longitude);
  }

  public boolean isValid() {
    return Double.isFinite(latitude) && Double.isFinite(longitude)
        && latitude >= -90.0 && latitude <= 90.0
        && longitude >= -180.0 && longitude <= 180.0;
  }

  /** Great-circle (haversine) distance. */
  public double distanceKm(GeoPoint other) {
    double dLat = Math.toRadians(other.latitude - latitude);
    double dLng = Math.toRadians(other.longitude - longitude);
    double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
        + Math.cos(Math.toRadians(latitude)) * Math.cos(Math.toRadians(other.latitude))
        * Math.sin(dLng / 2) * Math.sin(dLng / 2);
    return EARTH_RADIUS_KM * 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
  }

  @Override
  public String toString() {
    return latitude + "," + longitude;
  }
}
