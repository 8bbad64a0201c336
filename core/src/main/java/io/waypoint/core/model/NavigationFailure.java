package io.waypoint.core.model;

import java.util.Objects;

/**
 * A navigation that ended without committing and without an error. Returned, never thrown.
 *
 * @param kind failure kind
 * @param from location the navigation started from
 * @param to   target of the navigation; for {@link FailureKind#REDIRECTED} the redirect target
 */
public record NavigationFailure(FailureKind kind, ResolvedLocation from, ResolvedLocation to) {

    public NavigationFailure {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
    }
}
