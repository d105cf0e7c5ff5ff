package com.airradar.aggregator.source;

import com.airradar.aggregator.config.AggregatorProperties;
import com.airradar.aggregator.model.BoundingBox;
import com.airradar.aggregator.model.Station;
import com.airradar.aggregator.model.StationSource;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fallback feed: the World Air Quality Index {@code map/bounds} endpoint.
 *
 * <p>Rows without a numeric AQI ({@code "-"} marks an offline station) are dropped. Pollutant
 * values are read from the optional {@code iaqi} breakdown.
 */
public class WaqiStationAdapter extends AbstractHttpStationAdapter {
  private final AggregatorProperties.Fallback properties;

  public WaqiStationAdapter(
      AggregatorProperties properties,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry,
      Clock clock) {
    super(StationSource.FALLBACK, httpClient, objectMapper, meterRegistry, clock);
    this.properties = properties.getSources().getFallback();
  }

  @Override
  public StationSource source() {
    return StationSource.FALLBACK;
  }

  @Override
  public boolean enabled() {
    return properties.isEnabled() && properties.getToken() != null && !properties.getToken().isBlank();
  }

  @Override
  protected Duration timeout() {
    Duration timeout = properties.getTimeout();
    return timeout == null || timeout.isNegative() || timeout.isZero() ? Duration.ofSeconds(5) : timeout;
  }

  @Override
  protected URI boundsUri(BoundingBox bbox) {
    String latlng = String.format(
        Locale.ROOT, "%s,%s,%s,%s", bbox.south(), bbox.west(), bbox.north(), bbox.east());
    return URI.create(properties.getBaseUrl().replaceAll("/+$", "")
        + "/map/bounds?latlng=" + URLEncoder.encode(latlng, StandardCharsets.UTF_8)
        + "&networks=all&token=" + URLEncoder.encode(properties.getToken().trim(), StandardCharsets.UTF_8));
  }

  @Override
  protected List<Station> parseStations(JsonNode root, int limit) {
    String status = root.path("status").asText("");
    if (!"ok".equals(status)) {
      throw new MalformedPayloadException("WAQI status=" + status + " data=" + root.path("data").asText(""));
    }
    JsonNode rows = root.path("data");
    if (!rows.isArray()) {
      throw new MalformedPayloadException("WAQI payload has no data array");
    }

    List<Station> stations = new ArrayList<>();
    for (JsonNode row : rows) {
      Integer aqi = parseAqi(row.get("aqi"));
      Double lat = number(row, "lat");
      Double lng = number(row, "lon");
      if (aqi == null || lat == null || lng == null) {
        continue;
      }
      stations.add(toStation(row, lat, lng, aqi));
      if (stations.size() >= limit) {
        break;
      }
    }
    return stations;
  }

  private static Station toStation(JsonNode row, double lat, double lng, int aqi) {
    JsonNode station = row.path("station");
    String name = text(station, "name");
    JsonNode iaqi = row.path("iaqi");

    return new Station(
        "waqi-" + text(row, "uid"),
        name == null ? "WAQI Station" : name,
        name == null ? "Unknown Location" : name,
        null,
        null,
        null,
        null,
        lat,
        lng,
        aqi,
        pollutant(iaqi, "pm25"),
        pollutant(iaqi, "no2"),
        pollutant(iaqi, "co"),
        pollutant(iaqi, "o3"),
        pollutant(iaqi, "so2"),
        readingTime(text(station, "time")),
        StationSource.FALLBACK,
        null,
        null,
        null);
  }

  private static Integer parseAqi(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.isNumber()) {
      return node.asInt();
    }
    String raw = node.asText().trim();
    if (raw.isEmpty() || "-".equals(raw)) {
      return null;
    }
    try {
      return (int) Math.round(Double.parseDouble(raw));
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  private static Double pollutant(JsonNode iaqi, String field) {
    JsonNode value = iaqi.path(field).path("v");
    return value.isNumber() ? value.asDouble() : null;
  }

  private static Instant readingTime(String raw) {
    if (raw == null) {
      return null;
    }
    try {
      return OffsetDateTime.parse(raw).toInstant();
    } catch (DateTimeParseException ex) {
      return null;
    }
  }
}
