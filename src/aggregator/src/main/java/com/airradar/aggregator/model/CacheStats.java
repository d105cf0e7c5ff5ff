package com.airradar.aggregator.model;

import java.util.List;

/**
 * Snapshot of the adapter result cache.
 *
 * @param size number of entries currently held, expired ones included until swept
 * @param keys cache keys
 */
public record CacheStats(int size, List<String> keys) {}
