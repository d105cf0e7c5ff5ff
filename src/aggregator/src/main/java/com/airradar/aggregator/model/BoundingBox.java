package com.airradar.aggregator.model;

/**
 * Rectangular lat/lng window used for area queries.
 *
 * <p>Expected to satisfy {@code north > south} and {@code east > west}; boxes crossing the
 * antimeridian are not representable.
 *
 * @param north northern latitude
 * @param south southern latitude
 * @param east eastern longitude
 * @param west western longitude
 */
public record BoundingBox(double north, double south, double east, double west) {
  public double centerLat() {
    return (north + south) / 2.0;
  }

  public double centerLng() {
    return (east + west) / 2.0;
  }

  /**
   * Computes the rectangular area in square degrees.
   *
   * @return area in deg²
   */
  public double areaDeg2() {
    return Math.max(0.0, (north - south) * (east - west));
  }
}
