package com.airradar.aggregator.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration container for the aggregation service.
 *
 * <p>Values are bound from {@code aggregator.*} in {@code application.yml} and environment
 * variables.
 */
@ConfigurationProperties(prefix = "aggregator")
public class AggregatorProperties {
  private final Api api = new Api();
  private final Cache cache = new Cache();
  private final Debounce debounce = new Debounce();
  private final Merge merge = new Merge();
  private final Cluster cluster = new Cluster();
  private final Sources sources = new Sources();

  public Api getApi() {
    return api;
  }

  public Cache getCache() {
    return cache;
  }

  public Debounce getDebounce() {
    return debounce;
  }

  public Merge getMerge() {
    return merge;
  }

  public Cluster getCluster() {
    return cluster;
  }

  public Sources getSources() {
    return sources;
  }

  /** Query defaults and hard limits applied before any upstream call. */
  public static class Api {
    private int defaultLimit = 100;
    private int maxLimit = 500;
    private double defaultRadiusKm = 100.0;
    private double maxRadiusKm = 500.0;
    private double singleStationRadiusKm = 0.1;
    private double maxBoundsAreaDeg2 = 400.0;
    private int maxPage = 10;

    public int getDefaultLimit() {
      return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
      this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
      return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
      this.maxLimit = maxLimit;
    }

    public double getDefaultRadiusKm() {
      return defaultRadiusKm;
    }

    public void setDefaultRadiusKm(double defaultRadiusKm) {
      this.defaultRadiusKm = defaultRadiusKm;
    }

    public double getMaxRadiusKm() {
      return maxRadiusKm;
    }

    public void setMaxRadiusKm(double maxRadiusKm) {
      this.maxRadiusKm = maxRadiusKm;
    }

    public double getSingleStationRadiusKm() {
      return singleStationRadiusKm;
    }

    public void setSingleStationRadiusKm(double singleStationRadiusKm) {
      this.singleStationRadiusKm = singleStationRadiusKm;
    }

    public double getMaxBoundsAreaDeg2() {
      return maxBoundsAreaDeg2;
    }

    public void setMaxBoundsAreaDeg2(double maxBoundsAreaDeg2) {
      this.maxBoundsAreaDeg2 = maxBoundsAreaDeg2;
    }

    public int getMaxPage() {
      return maxPage;
    }

    public void setMaxPage(int maxPage) {
      this.maxPage = maxPage;
    }
  }

  /** TTL cache sizing for adapter results. */
  public static class Cache {
    private Duration ttl = Duration.ofMinutes(5);
    private int maxEntries = 100;
    private int coordinateScale = 3;

    public Duration getTtl() {
      return ttl;
    }

    public void setTtl(Duration ttl) {
      this.ttl = ttl;
    }

    public int getMaxEntries() {
      return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
      this.maxEntries = maxEntries;
    }

    public int getCoordinateScale() {
      return coordinateScale;
    }

    public void setCoordinateScale(int coordinateScale) {
      this.coordinateScale = coordinateScale;
    }
  }

  /** Debounce window used to coalesce bursts of identical radius queries. */
  public static class Debounce {
    private Duration delay = Duration.ofMillis(300);
    private Duration maxWait = Duration.ofSeconds(2);

    public Duration getDelay() {
      return delay;
    }

    public void setDelay(Duration delay) {
      this.delay = delay;
    }

    public Duration getMaxWait() {
      return maxWait;
    }

    public void setMaxWait(Duration maxWait) {
      this.maxWait = maxWait;
    }
  }

  /** Source-priority merge policy. */
  public static class Merge {
    private double dedupEpsilonDeg = 0.001;
    private boolean fallbackShortCircuitEnabled = true;
    private double fallbackSkipRatio = 0.5;

    public double getDedupEpsilonDeg() {
      return dedupEpsilonDeg;
    }

    public void setDedupEpsilonDeg(double dedupEpsilonDeg) {
      this.dedupEpsilonDeg = dedupEpsilonDeg;
    }

    public boolean isFallbackShortCircuitEnabled() {
      return fallbackShortCircuitEnabled;
    }

    public void setFallbackShortCircuitEnabled(boolean fallbackShortCircuitEnabled) {
      this.fallbackShortCircuitEnabled = fallbackShortCircuitEnabled;
    }

    public double getFallbackSkipRatio() {
      return fallbackSkipRatio;
    }

    public void setFallbackSkipRatio(double fallbackSkipRatio) {
      this.fallbackSkipRatio = fallbackSkipRatio;
    }
  }

  /** Map pin clustering settings. */
  public static class Cluster {
    private double sizeKm = 5.0;

    public double getSizeKm() {
      return sizeKm;
    }

    public void setSizeKm(double sizeKm) {
      this.sizeKm = sizeKm;
    }
  }

  /** Upstream feed endpoints, one block per source. */
  public static class Sources {
    private final Primary primary = new Primary();
    private final Fallback fallback = new Fallback();
    private int fetchThreads = 8;
    private Duration fetchDeadline = Duration.ofSeconds(8);

    public Primary getPrimary() {
      return primary;
    }

    public Fallback getFallback() {
      return fallback;
    }

    public int getFetchThreads() {
      return fetchThreads;
    }

    public void setFetchThreads(int fetchThreads) {
      this.fetchThreads = fetchThreads;
    }

    public Duration getFetchDeadline() {
      return fetchDeadline;
    }

    public void setFetchDeadline(Duration fetchDeadline) {
      this.fetchDeadline = fetchDeadline;
    }
  }

  /** Malaysian DOE ArcGIS current-reading layer. */
  public static class Primary {
    private boolean enabled = true;
    private String queryUrl =
        "https://eqms.doe.gov.my/api3/publicmapproxy/PUBLIC_DISPLAY/CAQM_MCAQM_Current_Reading/MapServer/0/query";
    private Duration timeout = Duration.ofSeconds(5);
    private String country = "Malaysia";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getQueryUrl() {
      return queryUrl;
    }

    public void setQueryUrl(String queryUrl) {
      this.queryUrl = queryUrl;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public String getCountry() {
      return country;
    }

    public void setCountry(String country) {
      this.country = country;
    }
  }

  /** World Air Quality Index map feed, queried only to complete primary results. */
  public static class Fallback {
    private boolean enabled = true;
    private String baseUrl = "https://api.waqi.info";
    private String token = "";
    private Duration timeout = Duration.ofSeconds(5);

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getToken() {
      return token;
    }

    public void setToken(String token) {
      this.token = token;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }
  }
}
