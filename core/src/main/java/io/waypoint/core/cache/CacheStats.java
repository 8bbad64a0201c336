package io.waypoint.core.cache;

/**
 * Point-in-time cache counters.
 *
 * @param size      current entry count
 * @param capacity  current capacity
 * @param hits      lifetime hits
 * @param misses    lifetime misses
 * @param evictions entries evicted for capacity
 * @param resizes   adaptive capacity changes
 */
public record CacheStats(int size, int capacity, long hits, long misses, long evictions, long resizes) {

    /** Lifetime hit rate, {@code 0} before any lookup. */
    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
