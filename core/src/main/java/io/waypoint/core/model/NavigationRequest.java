package io.waypoint.core.model;

import java.util.Objects;

/**
 * One navigation attempt as handed to the pipeline. Discarded once the pipeline reaches a terminal state.
 *
 * @param from       location at the time the navigation started
 * @param to         requested target
 * @param trigger    push, replace or pop
 * @param generation generation number allocated to this navigation
 * @param state      opaque host state to store with the history entry, may be {@code null}
 */
public record NavigationRequest(
        ResolvedLocation from, RawLocation to, NavigationTrigger trigger, long generation, Object state) {

    public NavigationRequest {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(trigger, "trigger must not be null");
    }
}
