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
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Primary feed: the DOE ArcGIS MapServer layer of current continuous air quality readings.
 *
 * <p>The layer is filtered with a {@code WHERE} predicate on {@code LATITUDE}/{@code LONGITUDE}.
 * Each feature reports one composite {@code API} value plus the pollutant that drove it
 * ({@code PARAM_SELECTED}); that value is copied into the matching pollutant field.
 */
public class DoeArcGisStationAdapter extends AbstractHttpStationAdapter {
  private final AggregatorProperties.Primary properties;

  public DoeArcGisStationAdapter(
      AggregatorProperties properties,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry,
      Clock clock) {
    super(StationSource.PRIMARY, httpClient, objectMapper, meterRegistry, clock);
    this.properties = properties.getSources().getPrimary();
  }

  @Override
  public StationSource source() {
    return StationSource.PRIMARY;
  }

  @Override
  public boolean enabled() {
    return properties.isEnabled() && properties.getQueryUrl() != null && !properties.getQueryUrl().isBlank();
  }

  @Override
  protected Duration timeout() {
    Duration timeout = properties.getTimeout();
    return timeout == null || timeout.isNegative() || timeout.isZero() ? Duration.ofSeconds(5) : timeout;
  }

  @Override
  protected URI boundsUri(BoundingBox bbox) {
    String where = String.format(
        Locale.ROOT,
        "LATITUDE > %s AND LATITUDE < %s AND LONGITUDE > %s AND LONGITUDE < %s",
        bbox.south(), bbox.north(), bbox.west(), bbox.east());
    return URI.create(properties.getQueryUrl()
        + "?f=json&outFields=*&returnGeometry=false&where="
        + URLEncoder.encode(where, StandardCharsets.UTF_8));
  }

  @Override
  protected List<Station> parseStations(JsonNode root, int limit) {
    if (root.has("error")) {
      throw new MalformedPayloadException("ArcGIS error: " + root.path("error").path("message").asText("unknown"));
    }
    JsonNode features = root.path("features");
    if (!features.isArray()) {
      throw new MalformedPayloadException("ArcGIS payload has no features array");
    }

    List<Station> stations = new ArrayList<>();
    for (JsonNode feature : features) {
      JsonNode attrs = feature.path("attributes");
      if (!attrs.isObject()) {
        continue;
      }
      Double lat = number(attrs, "LATITUDE");
      Double lng = number(attrs, "LONGITUDE");
      // Unplaced stations are published with 0/0 or null coordinates.
      if (lat == null || lng == null || lat == 0.0 || lng == 0.0) {
        continue;
      }
      stations.add(toStation(attrs, lat, lng));
      if (stations.size() >= limit) {
        break;
      }
    }
    return stations;
  }

  private Station toStation(JsonNode attrs, double lat, double lng) {
    Double apiValue = number(attrs, "API");
    Integer aqi = apiValue == null ? null : (int) Math.round(apiValue);
    String param = text(attrs, "PARAM_SELECTED");
    String stationLocation = text(attrs, "STATION_LOCATION");

    return new Station(
        "doe-" + text(attrs, "STATION_ID"),
        stationLocation == null ? "DOE Station" : stationLocation,
        stationLocation == null ? "Unknown Location" : stationLocation,
        text(attrs, "PLACE"),
        properties.getCountry(),
        text(attrs, "STATE_NAME"),
        text(attrs, "REGION_NAME"),
        lat,
        lng,
        aqi,
        "PM2.5".equalsIgnoreCase(param) ? apiValue : null,
        "NO2".equalsIgnoreCase(param) ? apiValue : null,
        "CO".equalsIgnoreCase(param) ? apiValue : null,
        "O3".equalsIgnoreCase(param) ? apiValue : null,
        "SO2".equalsIgnoreCase(param) ? apiValue : null,
        readingTime(attrs.get("DATETIME")),
        StationSource.PRIMARY,
        null,
        text(attrs, "CLASS"),
        text(attrs, "STATION_CATEGORY"));
  }

  private static Instant readingTime(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.isNumber()) {
      return Instant.ofEpochMilli(node.asLong());
    }
    try {
      return Instant.parse(node.asText().trim());
    } catch (DateTimeParseException ex) {
      return null;
    }
  }
}
