package com.airradar.aggregator.source;

import com.airradar.aggregator.model.BoundingBox;
import com.airradar.aggregator.model.Coordinates;
import com.airradar.aggregator.model.SourceHealth;
import com.airradar.aggregator.model.Station;
import com.airradar.aggregator.model.StationSource;
import java.util.List;

/**
 * Normalizes one upstream feed into {@link Station} records tagged with its source.
 *
 * <p>Implementations never throw from the fetch methods: timeouts, non-2xx statuses and malformed
 * payloads yield an empty list, and the failure is only visible through {@link #health()} and
 * metrics.
 */
public interface StationSourceAdapter {
  StationSource source();

  boolean enabled();

  /**
   * Fetches stations within {@code radiusKm} of {@code center}.
   *
   * @param center query center
   * @param radiusKm query radius
   * @param limit maximum stations returned
   * @return stations with {@code distance} populated, nearest first, possibly empty
   */
  List<Station> fetchByRadius(Coordinates center, double radiusKm, int limit);

  /**
   * Fetches stations inside {@code bbox}.
   *
   * @param bbox query box
   * @param limit maximum stations returned
   * @return stations, possibly empty
   */
  List<Station> fetchByBounds(BoundingBox bbox, int limit);

  SourceHealth health();
}
