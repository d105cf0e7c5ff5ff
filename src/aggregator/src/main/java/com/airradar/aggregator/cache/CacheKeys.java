package com.airradar.aggregator.cache;

import com.airradar.aggregator.model.BoundingBox;
import com.airradar.aggregator.model.Coordinates;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Derives deterministic cache keys for upstream queries.
 *
 * <p>Coordinates are rounded to {@code scale} decimals (3 decimals ≈ 111 m) before hashing, so
 * GPS jitter inside one grid cell shares a cache entry.
 */
public class CacheKeys {
  private final int scale;

  public CacheKeys(int scale) {
    this.scale = Math.max(0, scale);
  }

  /**
   * Key for a radius query against one source.
   *
   * @param sourceId adapter id
   * @param center query center
   * @param radiusKm query radius
   * @param limit result limit
   * @return hex digest key
   */
  public String radius(String sourceId, Coordinates center, double radiusKm, int limit) {
    return key(sourceId, "radius", round(center.lat()), round(center.lng()), round(radiusKm), Integer.toString(limit));
  }

  /**
   * Key for a bounding-box query against one source.
   *
   * @param sourceId adapter id
   * @param bbox query box
   * @param limit result limit
   * @return hex digest key
   */
  public String bounds(String sourceId, BoundingBox bbox, int limit) {
    return key(
        sourceId,
        "bounds",
        round(bbox.north()),
        round(bbox.south()),
        round(bbox.east()),
        round(bbox.west()),
        Integer.toString(limit));
  }

  String round(double value) {
    return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).toPlainString();
  }

  private static String key(String sourceId, String kind, String... parts) {
    StringBuilder input = new StringBuilder(sourceId).append('|').append(kind);
    for (String part : parts) {
      input.append('|').append(part);
    }
    return kind + ":" + sha256(input.toString());
  }

  private static String sha256(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
      StringBuilder builder = new StringBuilder(hash.length * 2);
      for (byte b : hash) {
        builder.append(String.format("%02x", b));
      }
      return builder.toString();
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm unavailable", ex);
    }
  }
}
