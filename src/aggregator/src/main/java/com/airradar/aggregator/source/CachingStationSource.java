package com.airradar.aggregator.source;

import com.airradar.aggregator.cache.CacheKeys;
import com.airradar.aggregator.cache.CacheStore;
import com.airradar.aggregator.model.BoundingBox;
import com.airradar.aggregator.model.Coordinates;
import com.airradar.aggregator.model.SourceHealth;
import com.airradar.aggregator.model.Station;
import com.airradar.aggregator.model.StationSource;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.function.Supplier;

/**
 * Cache-checked view of an adapter.
 *
 * <p>Only non-empty results are cached: an empty list may mean the source is down, and caching it
 * would hide a recovery for a whole TTL.
 */
public class CachingStationSource implements StationSourceAdapter {
  private final StationSourceAdapter delegate;
  private final CacheStore<List<Station>> cache;
  private final CacheKeys cacheKeys;
  private final Counter hitCounter;
  private final Counter missCounter;

  public CachingStationSource(
      StationSourceAdapter delegate,
      CacheStore<List<Station>> cache,
      CacheKeys cacheKeys,
      MeterRegistry meterRegistry) {
    this.delegate = delegate;
    this.cache = cache;
    this.cacheKeys = cacheKeys;
    this.hitCounter = Counter.builder("aggregator.cache.hit.total")
        .description("Adapter result cache hits")
        .tag("source", delegate.source().id())
        .register(meterRegistry);
    this.missCounter = Counter.builder("aggregator.cache.miss.total")
        .description("Adapter result cache misses")
        .tag("source", delegate.source().id())
        .register(meterRegistry);
  }

  @Override
  public StationSource source() {
    return delegate.source();
  }

  @Override
  public boolean enabled() {
    return delegate.enabled();
  }

  @Override
  public List<Station> fetchByRadius(Coordinates center, double radiusKm, int limit) {
    String key = cacheKeys.radius(source().id(), center, radiusKm, limit);
    return cached(key, () -> delegate.fetchByRadius(center, radiusKm, limit));
  }

  @Override
  public List<Station> fetchByBounds(BoundingBox bbox, int limit) {
    String key = cacheKeys.bounds(source().id(), bbox, limit);
    return cached(key, () -> delegate.fetchByBounds(bbox, limit));
  }

  @Override
  public SourceHealth health() {
    return delegate.health();
  }

  private List<Station> cached(String key, Supplier<List<Station>> loader) {
    List<Station> hit = cache.get(key);
    if (hit != null) {
      hitCounter.increment();
      return hit;
    }
    missCounter.increment();

    List<Station> loaded = loader.get();
    if (loaded != null && !loaded.isEmpty()) {
      cache.set(key, List.copyOf(loaded));
      return loaded;
    }
    return List.of();
  }
}
