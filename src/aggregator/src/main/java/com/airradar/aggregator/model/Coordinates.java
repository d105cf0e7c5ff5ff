package com.airradar.aggregator.model;

/**
 * Geographic point in degrees.
 *
 * @param lat latitude
 * @param lng longitude
 */
public record Coordinates(double lat, double lng) {}
