package com.airradar.aggregator.source;

/**
 * Raised while parsing an upstream payload that does not have the expected shape.
 *
 * <p>Caught by {@link AbstractHttpStationAdapter} and recorded as a {@code parse_error} outcome.
 */
public class MalformedPayloadException extends RuntimeException {
  public MalformedPayloadException(String message) {
    super(message);
  }
}
