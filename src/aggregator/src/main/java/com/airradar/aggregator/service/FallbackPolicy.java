package com.airradar.aggregator.service;

/**
 * Decides whether lower-priority sources are worth querying once the primary has answered.
 *
 * @param shortCircuitEnabled when {@code false}, every source is always queried, in parallel
 * @param skipRatio share of the radius-query limit the primary must fill to skip the rest
 */
public record FallbackPolicy(boolean shortCircuitEnabled, double skipRatio) {

  /**
   * Radius queries skip the fallback once the primary filled {@code skipRatio} of the limit.
   *
   * @param primaryCount stations returned by the primary source
   * @param limit requested limit
   * @return {@code true} when lower-priority sources should not be queried
   */
  public boolean skipForRadius(int primaryCount, int limit) {
    return shortCircuitEnabled && primaryCount > 0 && primaryCount >= skipRatio * limit;
  }

  /**
   * Bounding-box queries only skip the fallback when the primary already filled the limit.
   *
   * @param primaryCount stations returned by the primary source
   * @param limit requested limit
   * @return {@code true} when lower-priority sources should not be queried
   */
  public boolean skipForBounds(int primaryCount, int limit) {
    return shortCircuitEnabled && primaryCount >= limit;
  }
}
