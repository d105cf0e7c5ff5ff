package com.airradar.aggregator.model;

import java.util.List;

/**
 * Group of nearby stations rendered as a single map pin.
 *
 * @param id cluster identifier ({@code cluster-<n>})
 * @param centerLat centroid latitude of members
 * @param centerLng centroid longitude of members
 * @param count number of members
 * @param averageAQI average AQI over members with a valid AQI
 * @param stations member stations
 */
public record StationCluster(
    String id,
    double centerLat,
    double centerLng,
    int count,
    int averageAQI,
    List<Station> stations) {}
