package com.airradar.aggregator.service;

import com.airradar.aggregator.api.BadRequestException;
import com.airradar.aggregator.geo.GeoMath;
import com.airradar.aggregator.model.BoundingBox;
import com.airradar.aggregator.model.Coordinates;
import java.util.Locale;

/**
 * Utility class for parsing and validating query parameters before any upstream call.
 */
public final class QueryParser {
  private QueryParser() {}

  /**
   * Parses a required latitude/longitude pair.
   *
   * @param latRaw raw latitude
   * @param lngRaw raw longitude
   * @return validated coordinates
   */
  public static Coordinates parseCoordinates(String latRaw, String lngRaw) {
    if (latRaw == null || latRaw.isBlank() || lngRaw == null || lngRaw.isBlank()) {
      throw new BadRequestException("lat and lng are required");
    }
    double lat = parseDouble(latRaw, "lat");
    double lng = parseDouble(lngRaw, "lng");
    if (!GeoMath.isValidLatitude(lat)) {
      throw new BadRequestException("latitude must be within [-90,90]");
    }
    if (!GeoMath.isValidLongitude(lng)) {
      throw new BadRequestException("longitude must be within [-180,180]");
    }
    return new Coordinates(lat, lng);
  }

  /**
   * Parses a bounding box formatted as {@code west,south,east,north}.
   *
   * @param raw raw bbox value
   * @param maxAreaDeg2 maximum accepted area in square degrees
   * @return validated bounding box
   */
  public static BoundingBox parseBounds(String raw, double maxAreaDeg2) {
    if (raw == null || raw.isBlank()) {
      throw new BadRequestException("bbox is required");
    }
    String[] chunks = raw.split(",");
    if (chunks.length != 4) {
      throw new BadRequestException("bbox must be west,south,east,north");
    }

    double west = parseDouble(chunks[0], "bbox");
    double south = parseDouble(chunks[1], "bbox");
    double east = parseDouble(chunks[2], "bbox");
    double north = parseDouble(chunks[3], "bbox");

    if (!GeoMath.isValidLongitude(west) || !GeoMath.isValidLongitude(east)) {
      throw new BadRequestException("longitude must be within [-180,180]");
    }
    if (!GeoMath.isValidLatitude(south) || !GeoMath.isValidLatitude(north)) {
      throw new BadRequestException("latitude must be within [-90,90]");
    }
    if (west >= east || south >= north) {
      throw new BadRequestException("bbox must satisfy west < east and south < north");
    }
    BoundingBox bbox = new BoundingBox(north, south, east, west);
    if (bbox.areaDeg2() > maxAreaDeg2) {
      throw new BadRequestException("bbox area exceeds configured maximum");
    }
    return bbox;
  }

  /**
   * Parses a radius in kilometers.
   *
   * @param raw raw radius
   * @param defaultRadiusKm value when absent
   * @param maxRadiusKm hard upper bound
   * @return validated radius
   */
  public static double parseRadius(String raw, double defaultRadiusKm, double maxRadiusKm) {
    if (raw == null || raw.isBlank()) {
      return defaultRadiusKm;
    }
    double radius = parseDouble(raw, "radius");
    if (radius <= 0) {
      throw new BadRequestException("radius must be > 0");
    }
    if (radius > maxRadiusKm) {
      throw new BadRequestException("radius exceeds maximum of " + maxRadiusKm + " km");
    }
    return radius;
  }

  /**
   * Parses and clamps result limits.
   *
   * @param raw raw limit query value
   * @param defaultLimit default value when absent
   * @param maxLimit hard upper bound
   * @return effective limit
   */
  public static int parseLimit(String raw, int defaultLimit, int maxLimit) {
    if (raw == null || raw.isBlank()) {
      return defaultLimit;
    }
    try {
      int parsed = Integer.parseInt(raw.trim());
      if (parsed <= 0) {
        throw new BadRequestException("limit must be > 0");
      }
      return Math.min(parsed, maxLimit);
    } catch (NumberFormatException ex) {
      throw new BadRequestException("limit must be an integer");
    }
  }

  /**
   * Parses a 1-based result page.
   *
   * @param raw raw page query value
   * @param maxPage highest page served
   * @return page number, {@code 1} when absent
   */
  public static int parsePage(String raw, int maxPage) {
    if (raw == null || raw.isBlank()) {
      return 1;
    }
    int parsed;
    try {
      parsed = Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new BadRequestException("page must be an integer");
    }
    if (parsed < 1 || parsed > maxPage) {
      throw new BadRequestException("page must be between 1 and " + maxPage);
    }
    return parsed;
  }

  /**
   * Parses an optional boolean flag.
   *
   * @param raw raw flag value
   * @param name parameter name used in error messages
   * @return {@code false} when absent
   */
  public static boolean parseFlag(String raw, String name) {
    if (raw == null || raw.isBlank()) {
      return false;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "1", "yes" -> true;
      case "false", "0", "no" -> false;
      default -> throw new BadRequestException(name + " must be true or false");
    };
  }

  private static double parseDouble(String raw, String name) {
    try {
      double value = Double.parseDouble(raw.trim());
      if (Double.isNaN(value) || Double.isInfinite(value)) {
        throw new BadRequestException(name + " must be a finite number");
      }
      return value;
    } catch (NumberFormatException ex) {
      throw new BadRequestException(name + " values must be numeric");
    }
  }
}
