package com.airradar.aggregator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Closed set of upstream station feeds, declared in merge priority order.
 *
 * <p>A lower {@link #priority()} wins when two feeds report the same physical station.
 */
public enum StationSource {
  PRIMARY("doe", 0),
  FALLBACK("waqi", 1);

  private final String id;
  private final int priority;

  StationSource(String id, int priority) {
    this.id = id;
    this.priority = priority;
  }

  @JsonValue
  public String id() {
    return id;
  }

  public int priority() {
    return priority;
  }

  /**
   * Resolves a source from its wire id or enum name.
   *
   * @param raw wire value such as {@code doe} or {@code PRIMARY}
   * @return matching source, or {@code null} when unknown
   */
  @JsonCreator
  public static StationSource fromId(String raw) {
    if (raw == null) {
      return null;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (StationSource source : values()) {
      if (source.id.equals(normalized) || source.name().toLowerCase(Locale.ROOT).equals(normalized)) {
        return source;
      }
    }
    return null;
  }
}
