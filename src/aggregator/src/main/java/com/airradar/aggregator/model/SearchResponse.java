package com.airradar.aggregator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Response contract for radius and bounding-box queries.
 *
 * @param success whether the query completed
 * @param data merged station list
 * @param summary area statistics, absent on failure
 * @param error failure description, absent on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchResponse(boolean success, List<Station> data, AreaSummary summary, String error) {

  public static SearchResponse ok(List<Station> data, AreaSummary summary) {
    return new SearchResponse(true, data, summary, null);
  }

  public static SearchResponse failure(String error) {
    return new SearchResponse(false, List.of(), null, error);
  }
}
