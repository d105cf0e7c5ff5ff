package com.airradar.aggregator.api;

/**
 * Raised when a single-point lookup finds no station in any source.
 *
 * <p>Mapped to HTTP 502 by {@link ApiExceptionHandler}. Area queries never raise it: an empty
 * area is a valid answer.
 */
public class NoDataFoundException extends RuntimeException {
  private final boolean sourcesUnavailable;

  /**
   * Creates a no-data exception.
   *
   * @param message client-facing message
   * @param sourcesUnavailable whether every enabled source failed its last call
   */
  public NoDataFoundException(String message, boolean sourcesUnavailable) {
    super(message);
    this.sourcesUnavailable = sourcesUnavailable;
  }

  public boolean isSourcesUnavailable() {
    return sourcesUnavailable;
  }
}
