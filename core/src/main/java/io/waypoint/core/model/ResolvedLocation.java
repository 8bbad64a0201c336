package io.waypoint.core.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A location after matching. An unmatched location has an empty chain and is a normal value, not an
 * error.
 *
 * @param path         normalized path
 * @param params       decoded params
 * @param query        query params
 * @param hash         hash without {@code #}
 * @param fullPath     path plus query and hash
 * @param matchedChain matched records root to leaf, empty if unmatched
 */
public record ResolvedLocation(
        String path,
        Map<String, String> params,
        QueryParams query,
        String hash,
        String fullPath,
        List<RouteRecord> matchedChain) {

    /** Initial location before the first navigation. */
    public static final ResolvedLocation START = unmatched("/", QueryParams.empty(), "");

    public ResolvedLocation {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(fullPath, "fullPath must not be null");
        params = params == null ? Map.of() : Map.copyOf(params);
        query = query == null ? QueryParams.empty() : query;
        hash = hash == null ? "" : hash;
        matchedChain = matchedChain == null ? List.of() : List.copyOf(matchedChain);
    }

    /** Builds a location, deriving the full path. */
    public static ResolvedLocation of(
            String path, Map<String, String> params, QueryParams query, String hash, List<RouteRecord> chain) {
        return new ResolvedLocation(path, params, query, hash, fullPath(path, query, hash), chain);
    }

    public static ResolvedLocation unmatched(String path, QueryParams query, String hash) {
        return of(path, Map.of(), query, hash, List.of());
    }

    /** Renders {@code path?query#hash}, omitting empty parts. */
    public static String fullPath(String path, QueryParams query, String hash) {
        StringBuilder sb = new StringBuilder(path);
        if (query != null && !query.isEmpty()) {
            sb.append('?').append(query.toQueryString());
        }
        if (hash != null && !hash.isEmpty()) {
            sb.append('#').append(hash);
        }
        return sb.toString();
    }

    public boolean matched() {
        return !matchedChain.isEmpty();
    }

    /** Leaf record, or {@code null} if unmatched. */
    public RouteRecord record() {
        return matchedChain.isEmpty() ? null : matchedChain.get(matchedChain.size() - 1);
    }

    /** Leaf route name, or {@code null}. */
    public String name() {
        RouteRecord leaf = record();
        return leaf == null ? null : leaf.name();
    }

    /** Metadata merged root to leaf; child keys override parent keys. */
    public Map<String, Object> meta() {
        Map<String, Object> merged = new LinkedHashMap<>();
        for (RouteRecord r : matchedChain) {
            merged.putAll(r.meta());
        }
        return merged;
    }
}
