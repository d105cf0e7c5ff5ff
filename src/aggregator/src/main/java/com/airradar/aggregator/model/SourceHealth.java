package com.airradar.aggregator.model;

import java.time.Instant;

/**
 * Last observed outcome of one upstream adapter.
 *
 * @param source feed
 * @param enabled whether the adapter is configured to run
 * @param lastOutcome outcome label of the most recent call ({@code unknown} before the first)
 * @param lastStationCount stations returned by the most recent call
 * @param lastCheckedAt time of the most recent call
 */
public record SourceHealth(
    StationSource source,
    boolean enabled,
    String lastOutcome,
    int lastStationCount,
    Instant lastCheckedAt) {

  /**
   * Whether the most recent call reached the upstream and parsed its payload.
   *
   * @return {@code true} for {@code success} and {@code empty} outcomes
   */
  public boolean reachable() {
    return "success".equals(lastOutcome) || "empty".equals(lastOutcome);
  }
}
