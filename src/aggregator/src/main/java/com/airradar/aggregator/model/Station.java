package com.airradar.aggregator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * One monitoring point normalized from any upstream feed.
 *
 * @param id source-prefixed station identifier
 * @param name display name
 * @param location free-text location label
 * @param city city or place name when known
 * @param country country when known
 * @param state state name when known
 * @param region region name when known
 * @param lat latitude in degrees
 * @param lng longitude in degrees
 * @param aqi composite air quality index, {@code null} when unreported
 * @param pm25 PM2.5 reading
 * @param no2 NO2 reading
 * @param co CO reading
 * @param o3 O3 reading
 * @param so2 SO2 reading
 * @param lastUpdated timestamp of the last reading
 * @param source feed that produced this station
 * @param distance km from the query center, only set inside radius results
 * @param stationClass air quality class label (Good, Moderate, ...)
 * @param category station category (Urban, Rural, ...)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Station(
    String id,
    String name,
    String location,
    String city,
    String country,
    String state,
    String region,
    double lat,
    double lng,
    Integer aqi,
    Double pm25,
    Double no2,
    Double co,
    Double o3,
    Double so2,
    Instant lastUpdated,
    StationSource source,
    Double distance,
    @JsonProperty("class") String stationClass,
    String category) {

  /**
   * Returns a copy carrying the distance from a query center.
   *
   * @param distanceKm distance in kilometers
   * @return station with {@code distance} populated
   */
  public Station withDistance(double distanceKm) {
    return new Station(
        id, name, location, city, country, state, region, lat, lng, aqi,
        pm25, no2, co, o3, so2, lastUpdated, source, distanceKm, stationClass, category);
  }

  /**
   * Checks whether this station reports a usable AQI value.
   *
   * @return {@code true} when {@code aqi > 0}
   */
  public boolean hasValidAqi() {
    return aqi != null && aqi > 0;
  }
}
