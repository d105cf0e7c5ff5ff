package com.airradar.aggregator.model;

import java.util.List;

/**
 * Request body for clustering a client-held station list.
 *
 * @param stations stations to cluster, in display order
 * @param clusterSizeKm optional cluster radius override
 */
public record ClusterRequest(List<Station> stations, Double clusterSizeKm) {}
