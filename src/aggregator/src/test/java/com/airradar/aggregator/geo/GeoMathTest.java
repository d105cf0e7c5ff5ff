package com.airradar.aggregator.geo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.airradar.aggregator.model.BoundingBox;
import com.airradar.aggregator.model.Coordinates;
import org.junit.jupiter.api.Test;

class GeoMathTest {

  private static final double LAT = 3.139;
  private static final double LNG = 101.6869;
  private static final Coordinates KUALA_LUMPUR = new Coordinates(LAT, LNG);

  @Test
  void distanceToSelfIsZero() {
    assertThat(GeoMath.haversineDistanceKm(LAT, LNG, LAT, LNG)).isEqualTo(0.0);
  }

  @Test
  void distanceIsSymmetric() {
    double there = GeoMath.haversineDistanceKm(LAT, LNG, 1.3521, 103.8198);
    double back = GeoMath.haversineDistanceKm(1.3521, 103.8198, LAT, LNG);

    assertThat(there).isCloseTo(back, within(1e-9));
    assertThat(there).isBetween(300.0, 320.0);
  }

  @Test
  void oneDegreeOfLatitudeIsAboutOneHundredElevenKm() {
    double km = GeoMath.haversineDistanceKm(0.0, 0.0, 1.0, 0.0);

    assertThat(km).isCloseTo(111.19, within(0.01));
  }

  @Test
  void boundingBoxUsesPlanarDeltas() {
    BoundingBox bbox = GeoMath.boundingBoxFromRadius(new Coordinates(0.0, 0.0), 111.0);

    assertThat(bbox.north()).isCloseTo(1.0, within(1e-9));
    assertThat(bbox.south()).isCloseTo(-1.0, within(1e-9));
    assertThat(bbox.east()).isCloseTo(1.0, within(1e-9));
    assertThat(bbox.west()).isCloseTo(-1.0, within(1e-9));
  }

  @Test
  void boundingBoxContainsCircleEdgePoints() {
    double radiusKm = 25.0;
    BoundingBox bbox = GeoMath.boundingBoxFromRadius(KUALA_LUMPUR, radiusKm);
    double latStep = radiusKm / (6371.0 * Math.PI / 180.0);

    assertThat(bbox.north()).isGreaterThanOrEqualTo(LAT + latStep);
    assertThat(bbox.south()).isLessThanOrEqualTo(LAT - latStep);
    assertThat(bbox.east()).isGreaterThanOrEqualTo(LNG + 0.2);
    assertThat(bbox.west()).isLessThanOrEqualTo(LNG - 0.2);
  }

  @Test
  void boundingBoxNearPoleStaysFiniteAndClamped() {
    BoundingBox bbox = GeoMath.boundingBoxFromRadius(new Coordinates(89.95, 10.0), 50.0);

    assertThat(bbox.north()).isEqualTo(90.0);
    assertThat(Double.isFinite(bbox.east())).isTrue();
    assertThat(Double.isFinite(bbox.west())).isTrue();
    assertThat(bbox.east()).isLessThanOrEqualTo(180.0);
    assertThat(bbox.west()).isGreaterThanOrEqualTo(-180.0);
  }

  @Test
  void coveringRadiusReachesBoxCorner() {
    BoundingBox bbox = new BoundingBox(4.0, 2.0, 102.0, 100.0);

    double radius = GeoMath.coveringRadiusKm(bbox);

    assertThat(radius).isCloseTo(GeoMath.haversineDistanceKm(3.0, 101.0, 4.0, 102.0), within(1e-9));
  }

  @Test
  void validatesCoordinateRanges() {
    assertThat(GeoMath.isValidLatitude(90.0)).isTrue();
    assertThat(GeoMath.isValidLatitude(90.1)).isFalse();
    assertThat(GeoMath.isValidLongitude(-180.0)).isTrue();
    assertThat(GeoMath.isValidLongitude(Double.NaN)).isFalse();
  }
}
