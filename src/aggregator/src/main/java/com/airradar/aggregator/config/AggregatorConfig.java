package com.airradar.aggregator.config;

import com.airradar.aggregator.cache.CacheKeys;
import com.airradar.aggregator.cache.CacheStore;
import com.airradar.aggregator.debounce.Debouncer;
import com.airradar.aggregator.model.SearchResponse;
import com.airradar.aggregator.model.Station;
import com.airradar.aggregator.service.FallbackPolicy;
import com.airradar.aggregator.service.StationClusterer;
import com.airradar.aggregator.service.StationMerger;
import com.airradar.aggregator.source.CachingStationSource;
import com.airradar.aggregator.source.DoeArcGisStationAdapter;
import com.airradar.aggregator.source.StationSourceAdapter;
import com.airradar.aggregator.source.WaqiStationAdapter;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires one cache, one debouncer and one cache-checked adapter per upstream feed.
 */
@Configuration
public class AggregatorConfig {
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public HttpClient httpClient() {
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(3))
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService stationFetchExecutor(AggregatorProperties properties) {
    return Executors.newFixedThreadPool(
        Math.max(2, properties.getSources().getFetchThreads()), daemonThreads("aggregator-fetch"));
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService debounceExecutor() {
    return Executors.newCachedThreadPool(daemonThreads("aggregator-debounce"));
  }

  @Bean
  public CacheStore<List<Station>> stationCache(
      AggregatorProperties properties, Clock clock, MeterRegistry meterRegistry) {
    CacheStore<List<Station>> cache = new CacheStore<>(
        clock, properties.getCache().getTtl(), properties.getCache().getMaxEntries());
    Gauge.builder("aggregator.cache.size", cache, CacheStore::size)
        .description("Entries held by the station cache, expired ones included until swept")
        .register(meterRegistry);
    FunctionCounter.builder("aggregator.cache.evicted.total", cache, CacheStore::evictedCount)
        .description("Expired station cache entries dropped")
        .register(meterRegistry);
    return cache;
  }

  @Bean
  public CacheKeys cacheKeys(AggregatorProperties properties) {
    return new CacheKeys(properties.getCache().getCoordinateScale());
  }

  @Bean(destroyMethod = "close")
  public Debouncer<SearchResponse> debouncer(
      AggregatorProperties properties,
      @Qualifier("debounceExecutor") ExecutorService debounceExecutor,
      MeterRegistry meterRegistry) {
    return new Debouncer<>(
        Executors.newSingleThreadScheduledExecutor(daemonThreads("aggregator-debounce-timer")),
        debounceExecutor,
        properties.getDebounce().getDelay(),
        properties.getDebounce().getMaxWait(),
        meterRegistry);
  }

  @Bean
  public StationSourceAdapter primaryStationSource(
      AggregatorProperties properties,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry,
      Clock clock,
      CacheStore<List<Station>> stationCache,
      CacheKeys cacheKeys) {
    DoeArcGisStationAdapter adapter =
        new DoeArcGisStationAdapter(properties, httpClient, objectMapper, meterRegistry, clock);
    return new CachingStationSource(adapter, stationCache, cacheKeys, meterRegistry);
  }

  @Bean
  public StationSourceAdapter fallbackStationSource(
      AggregatorProperties properties,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry,
      Clock clock,
      CacheStore<List<Station>> stationCache,
      CacheKeys cacheKeys) {
    WaqiStationAdapter adapter =
        new WaqiStationAdapter(properties, httpClient, objectMapper, meterRegistry, clock);
    return new CachingStationSource(adapter, stationCache, cacheKeys, meterRegistry);
  }

  @Bean
  public StationMerger stationMerger(AggregatorProperties properties) {
    return new StationMerger(properties.getMerge().getDedupEpsilonDeg());
  }

  @Bean
  public FallbackPolicy fallbackPolicy(AggregatorProperties properties) {
    return new FallbackPolicy(
        properties.getMerge().isFallbackShortCircuitEnabled(),
        properties.getMerge().getFallbackSkipRatio());
  }

  @Bean
  public StationClusterer stationClusterer(AggregatorProperties properties) {
    return new StationClusterer(properties.getCluster().getSizeKm());
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
