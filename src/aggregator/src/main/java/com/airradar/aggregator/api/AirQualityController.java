package com.airradar.aggregator.api;

import com.airradar.aggregator.config.AggregatorProperties;
import com.airradar.aggregator.model.BoundingBox;
import com.airradar.aggregator.model.CacheStats;
import com.airradar.aggregator.model.ClusterRequest;
import com.airradar.aggregator.model.Coordinates;
import com.airradar.aggregator.model.SearchResponse;
import com.airradar.aggregator.model.SourceHealth;
import com.airradar.aggregator.model.StationCluster;
import com.airradar.aggregator.model.StationReading;
import com.airradar.aggregator.service.AirQualityQueryService;
import com.airradar.aggregator.service.QueryParser;
import java.util.List;
import java.util.Locale;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller exposing the aggregation façade to the rest of the application.
 *
 * <p>Route design:
 * <ul>
 *   <li>{@code GET /api/air-quality/radius}: stations around a point, nearest first</li>
 *   <li>{@code GET /api/air-quality/bounds}: stations inside a map viewport</li>
 *   <li>{@code GET /api/air-quality/station}: reading of the station at a point</li>
 *   <li>{@code POST /api/air-quality/clusters}: map pin clusters for a station list</li>
 *   <li>{@code GET|DELETE /api/air-quality/cache}: cache statistics and reset</li>
 *   <li>{@code GET /api/air-quality/sources}: last outcome per upstream feed</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/air-quality")
public class AirQualityController {
  private final AirQualityQueryService queryService;
  private final AggregatorProperties properties;

  public AirQualityController(AirQualityQueryService queryService, AggregatorProperties properties) {
    this.queryService = queryService;
    this.properties = properties;
  }

  /**
   * Returns stations within a radius of a point.
   *
   * @param lat center latitude
   * @param lng center longitude
   * @param radius optional radius in km
   * @param limit optional max number of stations
   * @param debounce optional flag coalescing bursts of identical queries
   * @param cluster optional flag adding map clusters to the summary
   * @return search response
   */
  @GetMapping("/radius")
  public SearchResponse radius(
      @RequestParam(value = "lat", required = false) String lat,
      @RequestParam(value = "lng", required = false) String lng,
      @RequestParam(value = "radius", required = false) String radius,
      @RequestParam(value = "limit", required = false) String limit,
      @RequestParam(value = "debounce", required = false) String debounce,
      @RequestParam(value = "cluster", required = false) String cluster) {
    AggregatorProperties.Api api = properties.getApi();
    Coordinates center = QueryParser.parseCoordinates(lat, lng);
    double radiusKm = QueryParser.parseRadius(radius, api.getDefaultRadiusKm(), api.getMaxRadiusKm());
    int effectiveLimit = QueryParser.parseLimit(limit, api.getDefaultLimit(), api.getMaxLimit());
    return queryService.fetchByRadius(
        center,
        radiusKm,
        effectiveLimit,
        QueryParser.parseFlag(debounce, "debounce"),
        QueryParser.parseFlag(cluster, "cluster"));
  }

  /**
   * Returns stations inside a bounding box.
   *
   * @param bbox box in {@code west,south,east,north} format
   * @param limit optional page size
   * @param page optional 1-based page number
   * @param cluster optional flag adding map clusters to the summary
   * @return search response
   */
  @GetMapping("/bounds")
  public SearchResponse bounds(
      @RequestParam(value = "bbox", required = false) String bbox,
      @RequestParam(value = "limit", required = false) String limit,
      @RequestParam(value = "page", required = false) String page,
      @RequestParam(value = "cluster", required = false) String cluster) {
    AggregatorProperties.Api api = properties.getApi();
    BoundingBox box = QueryParser.parseBounds(bbox, api.getMaxBoundsAreaDeg2());
    int effectiveLimit = QueryParser.parseLimit(limit, api.getDefaultLimit(), api.getMaxLimit());
    return queryService.fetchByBounds(
        box,
        effectiveLimit,
        QueryParser.parsePage(page, api.getMaxPage()),
        QueryParser.parseFlag(cluster, "cluster"));
  }

  /**
   * Returns the reading of the station at a point.
   *
   * @param lat point latitude
   * @param lng point longitude
   * @return flat station reading
   */
  @GetMapping("/station")
  public StationReading station(
      @RequestParam(value = "lat", required = false) String lat,
      @RequestParam(value = "lng", required = false) String lng) {
    Coordinates center = QueryParser.parseCoordinates(lat, lng);
    return queryService.getSingleStation(center)
        .map(StationReading::from)
        .orElseThrow(() -> noData(center));
  }

  @PostMapping("/clusters")
  public List<StationCluster> clusters(@RequestBody ClusterRequest request) {
    if (request == null || request.stations() == null) {
      throw new BadRequestException("stations are required");
    }
    return queryService.clusterStations(request.stations(), request.clusterSizeKm());
  }

  @GetMapping("/cache")
  public CacheStats cacheStats() {
    return queryService.cacheStats();
  }

  @DeleteMapping("/cache")
  public ResponseEntity<Void> clearCache() {
    queryService.clearCache();
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/sources")
  public List<SourceHealth> sources() {
    return queryService.sourceHealth();
  }

  private NoDataFoundException noData(Coordinates center) {
    if (!queryService.anySourceReachable()) {
      return new NoDataFoundException("all air quality sources are currently unavailable", true);
    }
    return new NoDataFoundException(
        String.format(Locale.ROOT, "no air quality station found near (%s, %s)", center.lat(), center.lng()),
        false);
  }
}
