package com.airradar.aggregator.service;

import com.airradar.aggregator.model.AreaSummary;
import com.airradar.aggregator.model.Station;
import java.util.List;

/**
 * Summary statistics over station lists.
 *
 * <p>Only stations with {@code aqi > 0} take part in average, highest and lowest; every station
 * counts toward {@code totalStations}. Results are always finite, 0 when no station is valid.
 */
public final class AqiAggregator {
  private AqiAggregator() {}

  /**
   * Mean AQI over valid stations, rounded to the nearest integer.
   *
   * @param stations stations to average
   * @return average, or 0 when no station has a valid AQI
   */
  public static int averageAQI(List<Station> stations) {
    long sum = 0;
    int count = 0;
    for (Station station : stations) {
      if (station.hasValidAqi()) {
        sum += station.aqi();
        count++;
      }
    }
    return count == 0 ? 0 : (int) Math.round((double) sum / count);
  }

  public static int highestAQI(List<Station> stations) {
    double highest = Double.NEGATIVE_INFINITY;
    for (Station station : stations) {
      if (station.hasValidAqi()) {
        highest = Math.max(highest, station.aqi());
      }
    }
    return finiteOrZero(highest);
  }

  public static int lowestAQI(List<Station> stations) {
    double lowest = Double.POSITIVE_INFINITY;
    for (Station station : stations) {
      if (station.hasValidAqi()) {
        lowest = Math.min(lowest, station.aqi());
      }
    }
    return finiteOrZero(lowest);
  }

  /**
   * Builds the area summary for one query.
   *
   * @param centerLat query center latitude
   * @param centerLng query center longitude
   * @param radiusKm query or covering radius
   * @param stations result stations
   * @return summary recomputed from {@code stations}
   */
  public static AreaSummary summarize(double centerLat, double centerLng, double radiusKm, List<Station> stations) {
    return new AreaSummary(
        centerLat,
        centerLng,
        radiusKm,
        stations.size(),
        averageAQI(stations),
        highestAQI(stations),
        lowestAQI(stations),
        stations,
        null);
  }

  private static int finiteOrZero(double value) {
    return Double.isInfinite(value) || Double.isNaN(value) ? 0 : (int) value;
  }
}
