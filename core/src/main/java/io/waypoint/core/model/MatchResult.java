package io.waypoint.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A successful match of a path against the registered routes.
 *
 * @param record       matched leaf record
 * @param params       decoded param values by name
 * @param matchedChain records from root to leaf; the last element is {@code record}
 * @param score        specificity score of the match
 */
public record MatchResult(RouteRecord record, Map<String, String> params, List<RouteRecord> matchedChain, int score) {

    public MatchResult {
        Objects.requireNonNull(record, "record must not be null");
        params = Map.copyOf(params);
        matchedChain = List.copyOf(matchedChain);
    }

    /** Whether any record of the chain has the given id. */
    public boolean references(long recordId) {
        for (RouteRecord r : matchedChain) {
            if (r.id() == recordId || (r.aliasOf() != null && r.aliasOf() == recordId)) {
                return true;
            }
        }
        return false;
    }
}
