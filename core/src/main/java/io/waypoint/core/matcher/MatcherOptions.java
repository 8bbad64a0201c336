package io.waypoint.core.matcher;

import io.waypoint.core.cache.CachePolicy;
import java.util.Objects;

/**
 * Matcher settings.
 *
 * @param caseSensitive   whether static segments match case-sensitively
 * @param cacheEnabled    whether lookups go through the match cache
 * @param cachePolicy     cache sizing policy
 * @param maxTrackedPaths bound on distinct paths tracked for hotspot reporting; cold paths are evicted
 *                        to admit new ones
 */
public record MatcherOptions(
        boolean caseSensitive, boolean cacheEnabled, CachePolicy cachePolicy, int maxTrackedPaths) {

    public static final MatcherOptions DEFAULT = new MatcherOptions(false, true, CachePolicy.DEFAULT, 10_000);

    public MatcherOptions {
        Objects.requireNonNull(cachePolicy, "cachePolicy must not be null");
        if (maxTrackedPaths < 0) {
            throw new IllegalArgumentException("maxTrackedPaths must be >= 0, got: " + maxTrackedPaths);
        }
    }

    public MatcherOptions withCacheEnabled(boolean enabled) {
        return new MatcherOptions(caseSensitive, enabled, cachePolicy, maxTrackedPaths);
    }

    public MatcherOptions withCaseSensitive(boolean sensitive) {
        return new MatcherOptions(sensitive, cacheEnabled, cachePolicy, maxTrackedPaths);
    }
}
