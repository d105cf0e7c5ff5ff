package com.airradar.aggregator.cache;

import com.airradar.aggregator.model.CacheStats;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory key/TTL store for upstream results.
 *
 * <p>There is no LRU: live entries are never evicted. Once the entry count exceeds
 * {@code maxEntries}, a write triggers a sweep that drops expired entries only, so sustained
 * misses with distinct keys can grow the map until those entries expire. All operations hold the
 * instance monitor, which keeps the check-then-remove in {@link #get(String)} atomic.
 *
 * @param <T> cached value type
 */
public class CacheStore<T> {
  private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

  private final Map<String, CacheEntry<T>> entries = new HashMap<>();
  private final Clock clock;
  private final Duration defaultTtl;
  private final int maxEntries;
  private long evicted;

  /**
   * Creates a cache store.
   *
   * @param clock time source for expiry checks
   * @param defaultTtl TTL used by {@link #set(String, Object)}
   * @param maxEntries entry count above which writes trigger an expired-entry sweep
   */
  public CacheStore(Clock clock, Duration defaultTtl, int maxEntries) {
    this.clock = clock;
    this.defaultTtl = defaultTtl == null || defaultTtl.isNegative() || defaultTtl.isZero()
        ? Duration.ofMinutes(5)
        : defaultTtl;
    this.maxEntries = Math.max(1, maxEntries);
  }

  /**
   * Returns the cached value when still valid; stale entries are removed.
   *
   * @param key cache key
   * @return cached value, or {@code null} on miss
   */
  public synchronized T get(String key) {
    CacheEntry<T> entry = entries.get(key);
    if (entry == null) {
      return null;
    }
    if (entry.isValidAt(clock.millis())) {
      return entry.data();
    }
    entries.remove(key);
    evicted++;
    return null;
  }

  public void set(String key, T value) {
    set(key, value, defaultTtl);
  }

  /**
   * Stores a value with an explicit TTL.
   *
   * @param key cache key
   * @param value value to cache
   * @param ttl time-to-live, falls back to the default TTL when not positive
   */
  public synchronized void set(String key, T value, Duration ttl) {
    Duration effectiveTtl = ttl == null || ttl.isNegative() || ttl.isZero() ? defaultTtl : ttl;
    long now = clock.millis();
    entries.put(key, new CacheEntry<>(value, now, now + effectiveTtl.toMillis()));

    if (entries.size() > maxEntries) {
      sweepExpired();
    }
  }

  /**
   * Drops every expired entry.
   *
   * @return number of entries removed
   */
  public synchronized int sweepExpired() {
    long now = clock.millis();
    int removed = 0;
    Iterator<CacheEntry<T>> iterator = entries.values().iterator();
    while (iterator.hasNext()) {
      if (!iterator.next().isValidAt(now)) {
        iterator.remove();
        removed++;
      }
    }
    evicted += removed;
    if (removed > 0) {
      log.debug("Cache sweep removed {} expired entries, {} remaining", removed, entries.size());
    }
    return removed;
  }

  /**
   * Expired entries dropped so far, on read or by sweep.
   *
   * @return eviction count since creation
   */
  public synchronized long evictedCount() {
    return evicted;
  }

  public synchronized void clear() {
    entries.clear();
  }

  public synchronized int size() {
    return entries.size();
  }

  public synchronized CacheStats stats() {
    List<String> keys = new ArrayList<>(entries.keySet());
    return new CacheStats(entries.size(), keys);
  }
}
