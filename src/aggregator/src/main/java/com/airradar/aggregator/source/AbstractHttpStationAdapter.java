package com.airradar.aggregator.source;

import com.airradar.aggregator.geo.GeoMath;
import com.airradar.aggregator.model.BoundingBox;
import com.airradar.aggregator.model.Coordinates;
import com.airradar.aggregator.model.SourceHealth;
import com.airradar.aggregator.model.Station;
import com.airradar.aggregator.model.StationSource;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared HTTP plumbing for JSON station feeds.
 *
 * <p>Subclasses build the bounding-box URL and map the parsed payload; this class owns the
 * request timeout, status classification, outcome counters and the last-outcome health snapshot.
 * Radius queries are answered with a bbox fetch, an exact-distance filter and a nearest-first
 * sort, in that order, before the limit is applied.
 */
public abstract class AbstractHttpStationAdapter implements StationSourceAdapter {
  static final String OUTCOME_SUCCESS = "success";
  static final String OUTCOME_EMPTY = "empty";
  static final String OUTCOME_HTTP_ERROR = "http_error";
  static final String OUTCOME_PARSE_ERROR = "parse_error";
  static final String OUTCOME_TIMEOUT = "timeout";
  static final String OUTCOME_EXCEPTION = "exception";
  static final String OUTCOME_DISABLED = "disabled";
  private static final List<String> OUTCOMES = List.of(
      OUTCOME_SUCCESS, OUTCOME_EMPTY, OUTCOME_HTTP_ERROR, OUTCOME_PARSE_ERROR, OUTCOME_TIMEOUT, OUTCOME_EXCEPTION);

  private final Logger log = LoggerFactory.getLogger(getClass());

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final Timer requestTimer;
  private final Map<String, Counter> outcomeCounters = new LinkedHashMap<>();
  private final AtomicReference<SourceHealth> health;

  protected AbstractHttpStationAdapter(
      StationSource source,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.requestTimer = Timer.builder("aggregator.source.http.duration")
        .description("Upstream station feed HTTP request duration")
        .tag("source", source.id())
        .register(meterRegistry);
    // Keep cardinality low: one counter per outcome, no URL labels.
    for (String outcome : OUTCOMES) {
      outcomeCounters.put(outcome, Counter.builder("aggregator.source.requests.total")
          .description("Upstream station feed requests (by outcome)")
          .tag("source", source.id())
          .tag("outcome", outcome)
          .register(meterRegistry));
    }
    this.health = new AtomicReference<>(new SourceHealth(source, true, "unknown", 0, null));
  }

  /**
   * Builds the feed URL selecting stations inside {@code bbox}.
   *
   * @param bbox query box
   * @return request URI
   */
  protected abstract URI boundsUri(BoundingBox bbox);

  /**
   * Maps a parsed payload to stations.
   *
   * @param root parsed JSON body
   * @param limit maximum stations returned
   * @return normalized stations
   * @throws MalformedPayloadException when the payload shape is not recognized
   */
  protected abstract List<Station> parseStations(JsonNode root, int limit);

  protected abstract Duration timeout();

  @Override
  public List<Station> fetchByBounds(BoundingBox bbox, int limit) {
    if (!enabled()) {
      record(OUTCOME_DISABLED, 0);
      return List.of();
    }
    return fetch(boundsUri(bbox), limit);
  }

  @Override
  public List<Station> fetchByRadius(Coordinates center, double radiusKm, int limit) {
    BoundingBox bbox = GeoMath.boundingBoxFromRadius(center, radiusKm);
    // Upstream row order is arbitrary: every feature in the box is ranked before the limit applies.
    List<Station> candidates = fetchByBounds(bbox, Integer.MAX_VALUE);

    List<Station> inside = new ArrayList<>();
    for (Station station : candidates) {
      double distance = GeoMath.haversineDistanceKm(center.lat(), center.lng(), station.lat(), station.lng());
      if (distance <= radiusKm) {
        inside.add(station.withDistance(distance));
      }
    }
    inside.sort(Comparator.comparingDouble(Station::distance));
    return inside.size() > limit ? new ArrayList<>(inside.subList(0, Math.max(0, limit))) : inside;
  }

  @Override
  public SourceHealth health() {
    return health.get();
  }

  private List<Station> fetch(URI uri, int limit) {
    HttpRequest request = HttpRequest.newBuilder()
        .GET()
        .uri(uri)
        .timeout(timeout())
        .header("Accept", "application/json")
        .build();

    long startNs = System.nanoTime();
    try {
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      requestTimer.record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
      int status = response.statusCode();
      if (status < 200 || status >= 300) {
        log.warn("{} station fetch failed: status={}", source().id(), status);
        return failed(OUTCOME_HTTP_ERROR);
      }

      JsonNode root = objectMapper.readTree(response.body());
      List<Station> stations = parseStations(root, limit);
      record(stations.isEmpty() ? OUTCOME_EMPTY : OUTCOME_SUCCESS, stations.size());
      return stations;
    } catch (HttpTimeoutException ex) {
      log.warn("{} station fetch timed out after {}", source().id(), timeout());
      return failed(OUTCOME_TIMEOUT);
    } catch (MalformedPayloadException | IOException ex) {
      log.warn("{} station payload could not be parsed: {}", source().id(), ex.getMessage());
      return failed(OUTCOME_PARSE_ERROR);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("{} station fetch interrupted", source().id());
      return failed(OUTCOME_EXCEPTION);
    } catch (RuntimeException ex) {
      log.error("{} station fetch failed", source().id(), ex);
      return failed(OUTCOME_EXCEPTION);
    }
  }

  private List<Station> failed(String outcome) {
    record(outcome, 0);
    return List.of();
  }

  private void record(String outcome, int stationCount) {
    Counter counter = outcomeCounters.get(outcome);
    if (counter != null) {
      counter.increment();
    }
    health.set(new SourceHealth(source(), enabled(), outcome, stationCount, clock.instant()));
  }

  protected static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    String trimmed = value.asText().trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  protected static Double number(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    if (value.isNumber()) {
      return value.asDouble();
    }
    try {
      return Double.parseDouble(value.asText().trim());
    } catch (NumberFormatException ex) {
      return null;
    }
  }
}
