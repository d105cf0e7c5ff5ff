package com.airradar.aggregator.service;

import com.airradar.aggregator.model.Station;
import com.airradar.aggregator.model.StationSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Combines per-source result sets into one list under a source-priority policy.
 *
 * <p>Stations of the highest-priority source are all kept. A station from a lower-priority
 * source is a duplicate when both its latitude and longitude differ by less than
 * {@code epsilonDeg} from an already kept station; this grid-cell test is coarser than a
 * geodesic one and misjudges pairs sitting right at the {@code epsilonDeg} boundary.
 * Non-duplicates are appended only while the list is under the limit.
 */
public class StationMerger {
  private final double epsilonDeg;

  public StationMerger(double epsilonDeg) {
    this.epsilonDeg = Math.max(0.0, epsilonDeg);
  }

  /**
   * Merges results in {@code priorityOrder}.
   *
   * @param priorityOrder sources, highest priority first
   * @param resultsBySource fetched stations per source; missing sources count as empty
   * @param limit maximum size once lower-priority stations are appended
   * @return deduplicated stations
   */
  public List<Station> merge(
      List<StationSource> priorityOrder,
      Map<StationSource, List<Station>> resultsBySource,
      int limit) {
    List<Station> kept = new ArrayList<>();
    boolean first = true;
    for (StationSource source : priorityOrder) {
      List<Station> stations = resultsBySource.getOrDefault(source, List.of());
      if (first) {
        kept.addAll(stations);
        first = false;
        continue;
      }
      for (Station candidate : stations) {
        if (kept.size() >= limit) {
          return kept;
        }
        if (!isDuplicateOfAny(candidate, kept)) {
          kept.add(candidate);
        }
      }
    }
    return kept;
  }

  boolean isDuplicate(Station a, Station b) {
    return Math.abs(a.lat() - b.lat()) < epsilonDeg && Math.abs(a.lng() - b.lng()) < epsilonDeg;
  }

  private boolean isDuplicateOfAny(Station candidate, List<Station> kept) {
    for (Station station : kept) {
      if (isDuplicate(candidate, station)) {
        return true;
      }
    }
    return false;
  }
}
