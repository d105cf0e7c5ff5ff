package com.airradar.aggregator.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.airradar.aggregator.config.AggregatorProperties;
import com.airradar.aggregator.model.BoundingBox;
import com.airradar.aggregator.model.Coordinates;
import com.airradar.aggregator.model.Station;
import com.airradar.aggregator.model.StationSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;

class WaqiStationAdapterTest {

  private AggregatorProperties properties;
  private HttpClient httpClient;
  private WaqiStationAdapter adapter;

  @BeforeEach
  void setUp() {
    properties = new AggregatorProperties();
    properties.getSources().getFallback().setBaseUrl("https://waqi.example/");
    properties.getSources().getFallback().setToken("demo-token");
    httpClient = mock(HttpClient.class);
    adapter = new WaqiStationAdapter(
        properties, httpClient, new ObjectMapper(), new SimpleMeterRegistry(), Clock.systemUTC());
  }

  @Test
  void fetchByBoundsDropsOfflineStationsAndReadsBreakdown() throws Exception {
    respond("""
        {
          "status": "ok",
          "data": [
            {"uid": 8503, "lat": 3.1, "lon": 101.7, "aqi": "57",
             "station": {"name": "Cheras, Kuala Lumpur", "time": "2026-10-18T10:00:00+08:00"},
             "iaqi": {"pm25": {"v": 57}, "no2": {"v": 9.5}}},
            {"uid": 8504, "lat": 3.2, "lon": 101.6, "aqi": "-", "station": {"name": "Offline"}},
            {"uid": 8505, "lat": 3.3, "lon": 101.5, "aqi": 21, "station": {}}
          ]
        }
        """);

    List<Station> stations = adapter.fetchByBounds(new BoundingBox(3.5, 2.5, 102.0, 101.0), 10);

    assertThat(stations).extracting(Station::id).containsExactly("waqi-8503", "waqi-8505");
    Station cheras = stations.get(0);
    assertThat(cheras.name()).isEqualTo("Cheras, Kuala Lumpur");
    assertThat(cheras.aqi()).isEqualTo(57);
    assertThat(cheras.pm25()).isEqualTo(57.0);
    assertThat(cheras.no2()).isEqualTo(9.5);
    assertThat(cheras.so2()).isNull();
    assertThat(cheras.lastUpdated()).isEqualTo(Instant.parse("2026-10-18T02:00:00Z"));
    assertThat(cheras.source()).isEqualTo(StationSource.FALLBACK);
    assertThat(stations.get(1).name()).isEqualTo("WAQI Station");

    ArgumentCaptor<HttpRequest> requestCaptor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(requestCaptor.capture(), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    assertThat(requestCaptor.getValue().uri().toString()).isEqualTo(
        "https://waqi.example/map/bounds?latlng=2.5%2C101.0%2C3.5%2C102.0&networks=all&token=demo-token");
  }

  @Test
  void fetchByRadiusReturnsNearestStationsFirst() throws Exception {
    respond("""
        {"status": "ok", "data": [
          {"uid": 8, "lat": 3.20995, "lon": 101.6869, "aqi": 80},
          {"uid": 30, "lat": 3.40, "lon": 101.6869, "aqi": 90},
          {"uid": 1, "lat": 3.14799, "lon": 101.6869, "aqi": 40},
          {"uid": 4, "lat": 3.17497, "lon": 101.6869, "aqi": 60}
        ]}
        """);

    List<Station> stations = adapter.fetchByRadius(new Coordinates(3.139, 101.6869), 10.0, 2);

    assertThat(stations).extracting(Station::id).containsExactly("waqi-1", "waqi-4");
    assertThat(stations).allSatisfy(station -> assertThat(station.distance()).isLessThanOrEqualTo(10.0));
  }

  @Test
  void limitStopsParsing() throws Exception {
    respond("""
        {"status": "ok", "data": [
          {"uid": 1, "lat": 3.1, "lon": 101.7, "aqi": 10},
          {"uid": 2, "lat": 3.2, "lon": 101.7, "aqi": 20}
        ]}
        """);

    assertThat(adapter.fetchByBounds(new BoundingBox(3.5, 2.5, 102.0, 101.0), 1)).hasSize(1);
  }

  @Test
  void errorStatusIsAParseError() throws Exception {
    respond("{\"status\": \"error\", \"data\": \"Invalid key\"}");

    assertThat(adapter.fetchByBounds(new BoundingBox(3.5, 2.5, 102.0, 101.0), 10)).isEmpty();
    assertThat(adapter.health().lastOutcome()).isEqualTo("parse_error");
  }

  @Test
  void blankTokenDisablesAdapter() {
    properties.getSources().getFallback().setToken("  ");

    assertThat(adapter.enabled()).isFalse();
    assertThat(adapter.fetchByBounds(new BoundingBox(3.5, 2.5, 102.0, 101.0), 10)).isEmpty();
    verifyNoInteractions(httpClient);
  }

  private void respond(String body) throws Exception {
    @SuppressWarnings("unchecked")
    HttpResponse<String> response = (HttpResponse<String>) mock(HttpResponse.class);
    when(response.statusCode()).thenReturn(200);
    when(response.body()).thenReturn(body);
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(response);
  }
}
