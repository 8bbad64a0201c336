package io.waypoint.core.cache;

/**
 * Sizing policy for a {@link MatchCache}.
 *
 * @param minCapacity     lower capacity bound, at least 1
 * @param maxCapacity     upper capacity bound
 * @param initialCapacity starting capacity, clamped into bounds
 * @param checkInterval   lookups between two adaptive checks
 * @param lowHitRate      below this hit rate the cache grows
 * @param highHitRate     above this hit rate the cache shrinks
 * @param growthFactor    multiplier applied when growing, greater than 1
 * @param shrinkFactor    multiplier applied when shrinking, between 0 and 1
 */
public record CachePolicy(
        int minCapacity,
        int maxCapacity,
        int initialCapacity,
        int checkInterval,
        double lowHitRate,
        double highHitRate,
        double growthFactor,
        double shrinkFactor) {

    public static final CachePolicy DEFAULT = new CachePolicy(64, 4096, 512, 1000, 0.5, 0.9, 2.0, 0.75);

    public CachePolicy {
        if (minCapacity < 1) {
            throw new IllegalArgumentException("minCapacity must be >= 1, got: " + minCapacity);
        }
        if (maxCapacity < minCapacity) {
            throw new IllegalArgumentException(
                    "maxCapacity must be >= minCapacity, got: " + maxCapacity + " < " + minCapacity);
        }
        if (checkInterval < 1) {
            throw new IllegalArgumentException("checkInterval must be >= 1, got: " + checkInterval);
        }
        if (lowHitRate < 0 || highHitRate > 1 || lowHitRate > highHitRate) {
            throw new IllegalArgumentException(
                    "hit rate thresholds must satisfy 0 <= low <= high <= 1, got: " + lowHitRate + ", " + highHitRate);
        }
        if (growthFactor <= 1.0) {
            throw new IllegalArgumentException("growthFactor must be > 1, got: " + growthFactor);
        }
        if (shrinkFactor <= 0 || shrinkFactor >= 1.0) {
            throw new IllegalArgumentException("shrinkFactor must be in (0, 1), got: " + shrinkFactor);
        }
        initialCapacity = Math.max(minCapacity, Math.min(maxCapacity, initialCapacity));
    }

    /** A non-adaptive policy with a fixed capacity. */
    public static CachePolicy fixed(int capacity) {
        return new CachePolicy(capacity, capacity, capacity, Integer.MAX_VALUE, 0.0, 1.0, 2.0, 0.5);
    }
}
