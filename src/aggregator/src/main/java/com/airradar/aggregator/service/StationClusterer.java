package com.airradar.aggregator.service;

import com.airradar.aggregator.geo.GeoMath;
import com.airradar.aggregator.model.Station;
import com.airradar.aggregator.model.StationCluster;
import java.util.ArrayList;
import java.util.List;

/**
 * Single-pass greedy clustering for map pin decluttering.
 *
 * <p>Membership depends on input order: each unprocessed station seeds a cluster with every
 * unprocessed station within {@code clusterSizeKm} of it, so reordering the input can move
 * stations near a boundary into another cluster.
 */
public class StationClusterer {
  private final double defaultClusterSizeKm;

  public StationClusterer(double defaultClusterSizeKm) {
    this.defaultClusterSizeKm = defaultClusterSizeKm > 0 ? defaultClusterSizeKm : 5.0;
  }

  public List<StationCluster> cluster(List<Station> stations) {
    return cluster(stations, defaultClusterSizeKm);
  }

  /**
   * Groups stations around seeds taken in input order.
   *
   * @param stations ordered stations
   * @param clusterSizeKm maximum distance from the seed to a member
   * @return clusters in seed order
   */
  public List<StationCluster> cluster(List<Station> stations, double clusterSizeKm) {
    List<StationCluster> clusters = new ArrayList<>();
    boolean[] processed = new boolean[stations.size()];

    for (int i = 0; i < stations.size(); i++) {
      if (processed[i]) {
        continue;
      }
      Station seed = stations.get(i);
      List<Station> members = new ArrayList<>();
      for (int j = i; j < stations.size(); j++) {
        if (processed[j]) {
          continue;
        }
        Station candidate = stations.get(j);
        if (GeoMath.haversineDistanceKm(seed.lat(), seed.lng(), candidate.lat(), candidate.lng()) <= clusterSizeKm) {
          processed[j] = true;
          members.add(candidate);
        }
      }
      clusters.add(toCluster("cluster-" + clusters.size(), members));
    }
    return clusters;
  }

  public double defaultClusterSizeKm() {
    return defaultClusterSizeKm;
  }

  private static StationCluster toCluster(String id, List<Station> members) {
    double latSum = 0.0;
    double lngSum = 0.0;
    for (Station member : members) {
      latSum += member.lat();
      lngSum += member.lng();
    }
    return new StationCluster(
        id,
        latSum / members.size(),
        lngSum / members.size(),
        members.size(),
        AqiAggregator.averageAQI(members),
        List.copyOf(members));
  }
}
