package com.airradar.aggregator.geo;

import com.airradar.aggregator.model.BoundingBox;
import com.airradar.aggregator.model.Coordinates;

/**
 * Distance and bounding-box primitives on a spherical Earth.
 *
 * <p>Longitude wraparound across ±180° is not handled: boxes are clamped to the valid range
 * instead of being split.
 */
public final class GeoMath {
  public static final double EARTH_RADIUS_KM = 6371.0;
  public static final double KM_PER_DEGREE_LAT = 111.0;
  /** Latitude used for the longitude delta is clamped here so {@code cos(lat)} stays away from 0. */
  public static final double MAX_PROJECTION_LAT = 85.0;

  private GeoMath() {}

  /**
   * Great-circle distance using the haversine formula.
   *
   * @param lat1 first latitude
   * @param lng1 first longitude
   * @param lat2 second latitude
   * @param lng2 second longitude
   * @return distance in kilometers
   */
  public static double haversineDistanceKm(double lat1, double lng1, double lat2, double lng2) {
    double dLat = Math.toRadians(lat2 - lat1);
    double dLng = Math.toRadians(lng2 - lng1);
    double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
        + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
        * Math.sin(dLng / 2) * Math.sin(dLng / 2);
    double c = 2 * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
    return EARTH_RADIUS_KM * c;
  }

  /**
   * Builds the rectangle enclosing a circle with a planar approximation.
   *
   * <p>{@code latDelta = r/111}, {@code lngDelta = r/(111·cos(lat))}. The box is a superset of the
   * circle, so callers must post-filter by exact distance.
   *
   * @param center circle center
   * @param radiusKm circle radius in kilometers
   * @return enclosing box clamped to valid coordinates
   */
  public static BoundingBox boundingBoxFromRadius(Coordinates center, double radiusKm) {
    double latDelta = radiusKm / KM_PER_DEGREE_LAT;
    double projectionLat = clamp(center.lat(), -MAX_PROJECTION_LAT, MAX_PROJECTION_LAT);
    double lngDelta = radiusKm / (KM_PER_DEGREE_LAT * Math.cos(Math.toRadians(projectionLat)));

    return new BoundingBox(
        clamp(center.lat() + latDelta, -90.0, 90.0),
        clamp(center.lat() - latDelta, -90.0, 90.0),
        clamp(center.lng() + lngDelta, -180.0, 180.0),
        clamp(center.lng() - lngDelta, -180.0, 180.0));
  }

  /**
   * Distance from the box center to its north-east corner.
   *
   * @param bbox bounding box
   * @return covering radius in kilometers
   */
  public static double coveringRadiusKm(BoundingBox bbox) {
    return haversineDistanceKm(bbox.centerLat(), bbox.centerLng(), bbox.north(), bbox.east());
  }

  public static boolean isValidLatitude(double lat) {
    return !Double.isNaN(lat) && lat >= -90.0 && lat <= 90.0;
  }

  public static boolean isValidLongitude(double lng) {
    return !Double.isNaN(lng) && lng >= -180.0 && lng <= 180.0;
  }

  private static double clamp(double value, double min, double max) {
    return Math.max(min, Math.min(max, value));
  }
}
