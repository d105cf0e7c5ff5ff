package com.airradar.aggregator.cache;

/**
 * Cached value with its write time and absolute expiry, both in epoch milliseconds.
 *
 * @param data cached value
 * @param timestamp write time
 * @param expiry {@code timestamp + ttl}
 * @param <T> value type
 */
public record CacheEntry<T>(T data, long timestamp, long expiry) {
  /**
   * An entry is a hit only strictly before its expiry.
   *
   * @param nowMs current epoch milliseconds
   * @return {@code true} when the entry may be served
   */
  public boolean isValidAt(long nowMs) {
    return nowMs < expiry;
  }
}
