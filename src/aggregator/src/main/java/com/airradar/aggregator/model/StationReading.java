package com.airradar.aggregator.model;

import java.time.Instant;

/**
 * Flat pollutant reading returned by the single-station endpoint.
 *
 * @param location station location label
 * @param city city when known
 * @param country country when known
 * @param pm25 PM2.5 reading
 * @param no2 NO2 reading
 * @param co CO reading
 * @param o3 O3 reading
 * @param so2 SO2 reading
 * @param unit concentration unit
 * @param lastUpdated timestamp of the reading
 * @param source feed id
 * @param aqi composite index
 */
public record StationReading(
    String location,
    String city,
    String country,
    Double pm25,
    Double no2,
    Double co,
    Double o3,
    Double so2,
    String unit,
    Instant lastUpdated,
    StationSource source,
    Integer aqi) {

  public static final String UNIT = "µg/m³";

  public static StationReading from(Station station) {
    return new StationReading(
        station.location(),
        station.city(),
        station.country(),
        station.pm25(),
        station.no2(),
        station.co(),
        station.o3(),
        station.so2(),
        UNIT,
        station.lastUpdated(),
        station.source(),
        station.aqi());
  }
}
