package io.waypoint.core.model;

import java.util.Objects;

/**
 * Outcome of a {@code push}/{@code replace}/{@code go}: either a committed location or a
 * {@link NavigationFailure}. Errors are not represented here; they complete the navigation future
 * exceptionally.
 */
public final class NavigationResult {

    private final ResolvedLocation location;
    private final ResolvedLocation redirectedFrom;
    private final NavigationFailure failure;

    private NavigationResult(ResolvedLocation location, ResolvedLocation redirectedFrom, NavigationFailure failure) {
        this.location = location;
        this.redirectedFrom = redirectedFrom;
        this.failure = failure;
    }

    /**
     * A committed navigation.
     *
     * @param location       the committed location
     * @param redirectedFrom the originally requested location if redirects were followed, else {@code null}
     */
    public static NavigationResult success(ResolvedLocation location, ResolvedLocation redirectedFrom) {
        Objects.requireNonNull(location, "location must not be null");
        return new NavigationResult(location, redirectedFrom, null);
    }

    public static NavigationResult failure(NavigationFailure failure) {
        Objects.requireNonNull(failure, "failure must not be null");
        return new NavigationResult(null, null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /** Whether this is a failure of the given kind. */
    public boolean isFailure(FailureKind kind) {
        return failure != null && failure.kind() == kind;
    }

    /** The committed location, or {@code null} on failure. */
    public ResolvedLocation location() {
        return location;
    }

    /** The originally requested location when redirects were followed, or {@code null}. */
    public ResolvedLocation redirectedFrom() {
        return redirectedFrom;
    }

    /** The failure, or {@code null} on success. */
    public NavigationFailure failure() {
        return failure;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "NavigationResult{SUCCESS, to=" + location.fullPath() + "}"
                : "NavigationResult{" + failure.kind() + ", to=" + failure.to().fullPath() + "}";
    }
}
