package com.airradar.aggregator.service;

import com.airradar.aggregator.cache.CacheKeys;
import com.airradar.aggregator.cache.CacheStore;
import com.airradar.aggregator.config.AggregatorProperties;
import com.airradar.aggregator.debounce.Debouncer;
import com.airradar.aggregator.geo.GeoMath;
import com.airradar.aggregator.model.AreaSummary;
import com.airradar.aggregator.model.BoundingBox;
import com.airradar.aggregator.model.CacheStats;
import com.airradar.aggregator.model.Coordinates;
import com.airradar.aggregator.model.SearchResponse;
import com.airradar.aggregator.model.SourceHealth;
import com.airradar.aggregator.model.Station;
import com.airradar.aggregator.model.StationCluster;
import com.airradar.aggregator.model.StationSource;
import com.airradar.aggregator.source.StationSourceAdapter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.IntPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Query façade answering radius, bounding-box and single-point station lookups.
 *
 * <p>Pipeline: cache-checked adapter calls (primary first, the others only when the fallback
 * policy asks for them) → priority merge → radius post-filter → summary. Adapter failures are
 * absorbed as empty results; an area query with no data is a successful empty response.
 */
@Service
public class AirQualityQueryService {
  private static final Logger log = LoggerFactory.getLogger(AirQualityQueryService.class);

  private final List<StationSourceAdapter> adapters;
  private final List<StationSource> priorityOrder;
  private final StationMerger merger;
  private final FallbackPolicy fallbackPolicy;
  private final StationClusterer clusterer;
  private final Debouncer<SearchResponse> debouncer;
  private final CacheStore<List<Station>> stationCache;
  private final CacheKeys cacheKeys;
  private final ExecutorService fetchExecutor;
  private final AggregatorProperties properties;
  private final Counter fallbackSkippedCounter;

  /**
   * Creates the query façade.
   *
   * @param adapters cache-checked adapters, one per upstream feed
   * @param merger priority merger
   * @param fallbackPolicy short-circuit policy for lower-priority sources
   * @param clusterer map pin clusterer
   * @param debouncer coalescer for bursty radius queries
   * @param stationCache adapter result cache
   * @param cacheKeys cache key derivation, reused for debounce keys
   * @param fetchExecutor executor running adapter calls
   * @param properties typed aggregator configuration
   * @param meterRegistry metrics registry
   */
  public AirQualityQueryService(
      List<StationSourceAdapter> adapters,
      StationMerger merger,
      FallbackPolicy fallbackPolicy,
      StationClusterer clusterer,
      Debouncer<SearchResponse> debouncer,
      CacheStore<List<Station>> stationCache,
      CacheKeys cacheKeys,
      @Qualifier("stationFetchExecutor") ExecutorService fetchExecutor,
      AggregatorProperties properties,
      MeterRegistry meterRegistry) {
    this.adapters = adapters.stream()
        .sorted(Comparator.comparingInt(adapter -> adapter.source().priority()))
        .toList();
    this.priorityOrder = this.adapters.stream().map(StationSourceAdapter::source).toList();
    this.merger = merger;
    this.fallbackPolicy = fallbackPolicy;
    this.clusterer = clusterer;
    this.debouncer = debouncer;
    this.stationCache = stationCache;
    this.cacheKeys = cacheKeys;
    this.fetchExecutor = fetchExecutor;
    this.properties = properties;
    this.fallbackSkippedCounter = Counter.builder("aggregator.fallback.skipped.total")
        .description("Queries answered without lower-priority sources")
        .register(meterRegistry);
  }

  /**
   * Returns stations within {@code radiusKm} of {@code center}, nearest first.
   *
   * @param center query center
   * @param radiusKm query radius in kilometers
   * @param limit maximum stations returned
   * @param debounce coalesce with identical calls issued within the debounce window
   * @param cluster attach map clusters to the summary
   * @return search response; {@code success=true} with an empty list when no source has data
   */
  public SearchResponse fetchByRadius(
      Coordinates center, double radiusKm, int limit, boolean debounce, boolean cluster) {
    SearchResponse response;
    if (debounce) {
      String key = cacheKeys.radius("query", center, radiusKm, limit);
      response = await(debouncer.debounce(key, () -> radiusQuery(center, radiusKm, limit)));
    } else {
      response = radiusQuery(center, radiusKm, limit);
    }
    return cluster ? withClusters(response) : response;
  }

  /**
   * Returns one page of the stations inside {@code bbox}.
   *
   * <p>Page {@code n} holds merged stations {@code (n-1)*limit} to {@code n*limit - 1}. A page past
   * the end is a successful empty response.
   *
   * @param bbox query box
   * @param limit page size
   * @param page 1-based page number
   * @param cluster attach map clusters to the summary
   * @return search response summarized around the box centroid
   */
  public SearchResponse fetchByBounds(BoundingBox bbox, int limit, int page, boolean cluster) {
    SearchResponse response = boundsQuery(bbox, limit, Math.max(1, page));
    return cluster ? withClusters(response) : response;
  }

  /**
   * Looks up the station at a point, using a tiny radius query with limit 1.
   *
   * @param center point to look up
   * @return nearest station within the single-station radius, empty when none
   */
  public Optional<Station> getSingleStation(Coordinates center) {
    SearchResponse response = radiusQuery(center, properties.getApi().getSingleStationRadiusKm(), 1);
    if (!response.success() || response.data().isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(response.data().get(0));
  }

  /**
   * Clusters an arbitrary station list.
   *
   * @param stations ordered stations
   * @param clusterSizeKm cluster radius, configured default when {@code null}
   * @return clusters in seed order
   */
  public List<StationCluster> clusterStations(List<Station> stations, Double clusterSizeKm) {
    double size = clusterSizeKm == null || clusterSizeKm <= 0 ? clusterer.defaultClusterSizeKm() : clusterSizeKm;
    return clusterer.cluster(stations == null ? List.of() : stations, size);
  }

  /** Drops every cached adapter result and cancels pending debounce windows. */
  public void clearCache() {
    stationCache.clear();
    debouncer.cancelAll();
    log.info("Station cache cleared");
  }

  public CacheStats cacheStats() {
    return stationCache.stats();
  }

  public List<SourceHealth> sourceHealth() {
    return adapters.stream().map(StationSourceAdapter::health).toList();
  }

  /**
   * Whether at least one enabled source answered its most recent call.
   *
   * @return {@code false} when every enabled source last failed
   */
  public boolean anySourceReachable() {
    return adapters.stream()
        .filter(StationSourceAdapter::enabled)
        .map(StationSourceAdapter::health)
        .anyMatch(health -> health.reachable() || "unknown".equals(health.lastOutcome()));
  }

  private SearchResponse radiusQuery(Coordinates center, double radiusKm, int limit) {
    try {
      Map<StationSource, List<Station>> results = collect(
          adapter -> adapter.fetchByRadius(center, radiusKm, limit),
          primaryCount -> fallbackPolicy.skipForRadius(primaryCount, limit));
      List<Station> merged = merger.merge(priorityOrder, results, limit);

      // Adapters may answer from a box or a neighbouring cache cell; the exact circle is enforced here.
      List<Station> inside = new ArrayList<>();
      for (Station station : merged) {
        double distance = GeoMath.haversineDistanceKm(center.lat(), center.lng(), station.lat(), station.lng());
        if (distance <= radiusKm) {
          inside.add(station.withDistance(distance));
        }
      }
      inside.sort(Comparator.comparingDouble(Station::distance));
      List<Station> limited = List.copyOf(inside.subList(0, Math.min(limit, inside.size())));

      AreaSummary summary = AqiAggregator.summarize(center.lat(), center.lng(), radiusKm, limited);
      return SearchResponse.ok(limited, summary);
    } catch (RuntimeException ex) {
      log.error("Radius query failed for center=({}, {}) radiusKm={}", center.lat(), center.lng(), radiusKm, ex);
      return SearchResponse.failure(ex.getMessage() == null ? "unknown error" : ex.getMessage());
    }
  }

  private SearchResponse boundsQuery(BoundingBox bbox, int limit, int page) {
    try {
      int window = Math.multiplyExact(limit, page);
      Map<StationSource, List<Station>> results = collect(
          adapter -> adapter.fetchByBounds(bbox, window),
          primaryCount -> fallbackPolicy.skipForBounds(primaryCount, window));
      List<Station> merged = merger.merge(priorityOrder, results, window);
      int from = Math.min((page - 1) * limit, merged.size());
      List<Station> pageStations = List.copyOf(merged.subList(from, merged.size()));

      AreaSummary summary = AqiAggregator.summarize(
          bbox.centerLat(), bbox.centerLng(), GeoMath.coveringRadiusKm(bbox), pageStations);
      return SearchResponse.ok(pageStations, summary);
    } catch (RuntimeException ex) {
      log.error("Bounds query failed for bbox={}", bbox, ex);
      return SearchResponse.failure(ex.getMessage() == null ? "unknown error" : ex.getMessage());
    }
  }

  private Map<StationSource, List<Station>> collect(
      Function<StationSourceAdapter, List<Station>> call, IntPredicate skipLowerPriority) {
    Map<StationSource, List<Station>> results = new EnumMap<>(StationSource.class);
    if (adapters.isEmpty()) {
      return results;
    }

    if (!fallbackPolicy.shortCircuitEnabled()) {
      Map<StationSource, CompletableFuture<List<Station>>> futures = new LinkedHashMap<>();
      for (StationSourceAdapter adapter : adapters) {
        futures.put(adapter.source(), fetchAsync(adapter, call));
      }
      futures.forEach((source, future) -> results.put(source, future.join()));
      return results;
    }

    StationSourceAdapter primary = adapters.get(0);
    List<Station> primaryStations = fetchAsync(primary, call).join();
    results.put(primary.source(), primaryStations);
    if (skipLowerPriority.test(primaryStations.size())) {
      fallbackSkippedCounter.increment();
      log.debug("Skipping lower-priority sources: {} returned {} stations", primary.source().id(), primaryStations.size());
      return results;
    }

    Map<StationSource, CompletableFuture<List<Station>>> futures = new LinkedHashMap<>();
    for (StationSourceAdapter adapter : adapters.subList(1, adapters.size())) {
      futures.put(adapter.source(), fetchAsync(adapter, call));
    }
    futures.forEach((source, future) -> results.put(source, future.join()));
    return results;
  }

  private CompletableFuture<List<Station>> fetchAsync(
      StationSourceAdapter adapter, Function<StationSourceAdapter, List<Station>> call) {
    Duration deadline = fetchDeadline();
    return CompletableFuture.supplyAsync(() -> call.apply(adapter), fetchExecutor)
        .completeOnTimeout(null, deadline.toMillis(), TimeUnit.MILLISECONDS)
        .handle((stations, error) -> {
          if (error != null) {
            log.warn("{} fetch failed outside the adapter", adapter.source().id(), error);
            return List.<Station>of();
          }
          if (stations == null) {
            log.warn("{} fetch exceeded deadline of {}", adapter.source().id(), deadline);
            return List.<Station>of();
          }
          return stations;
        });
  }

  private Duration fetchDeadline() {
    Duration deadline = properties.getSources().getFetchDeadline();
    return deadline == null || deadline.isNegative() || deadline.isZero() ? Duration.ofSeconds(8) : deadline;
  }

  private SearchResponse withClusters(SearchResponse response) {
    if (!response.success() || response.summary() == null) {
      return response;
    }
    List<StationCluster> clusters = clusterer.cluster(response.data());
    return new SearchResponse(true, response.data(), response.summary().withClusters(clusters), null);
  }

  private static SearchResponse await(CompletableFuture<SearchResponse> future) {
    try {
      return future.join();
    } catch (CancellationException ex) {
      return SearchResponse.failure("query cancelled");
    } catch (CompletionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      return SearchResponse.failure(cause.getMessage() == null ? "unknown error" : cause.getMessage());
    }
  }
}
