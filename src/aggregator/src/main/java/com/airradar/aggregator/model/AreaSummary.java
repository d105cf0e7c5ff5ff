package com.airradar.aggregator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Statistics over the stations returned for one area query.
 *
 * @param centerLat query center latitude
 * @param centerLng query center longitude
 * @param radiusKm query radius, or covering radius for bounding-box queries
 * @param totalStations number of stations, including those without AQI
 * @param averageAQI mean AQI over stations with {@code aqi > 0}
 * @param highestAQI maximum valid AQI, 0 when none
 * @param lowestAQI minimum valid AQI, 0 when none
 * @param stations stations the summary was computed from
 * @param clusters optional map clusters
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AreaSummary(
    double centerLat,
    double centerLng,
    double radiusKm,
    int totalStations,
    int averageAQI,
    int highestAQI,
    int lowestAQI,
    List<Station> stations,
    List<StationCluster> clusters) {

  public AreaSummary withClusters(List<StationCluster> clusters) {
    return new AreaSummary(
        centerLat, centerLng, radiusKm, totalStations, averageAQI, highestAQI, lowestAQI, stations, clusters);
  }
}
