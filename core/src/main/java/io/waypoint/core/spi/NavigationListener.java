package io.waypoint.core.spi;

import io.waypoint.core.model.NavigationTrigger;

/**
 * SPI for navigation observability hooks.
 *
 * <p>
 * Hosts bridge these events to their metrics or tracing systems; the core has no telemetry dependency.
 * All methods receive immutable events. Implementations must be non-blocking. Exceptions thrown by a
 * listener are caught and logged by the pipeline and never affect the navigation.
 */
public interface NavigationListener {

    /** A navigation was allocated a generation and entered the pending state. */
    void onNavigationStarted(NavigationStartedEvent event);

    /** A navigation was committed to history. */
    void onNavigationConfirmed(NavigationConfirmedEvent event);

    /** A navigation ended with a non-exceptional failure (aborted, duplicated, redirected, cancelled). */
    void onNavigationAborted(NavigationAbortedEvent event);

    /** A navigation failed with an error. */
    void onNavigationFailed(NavigationFailedEvent event);

    // --- Event records ---

    /** Event emitted when a navigation starts. */
    record NavigationStartedEvent(long generation, String to, String from, NavigationTrigger trigger) {}

    /** Event emitted on commit. */
    record NavigationConfirmedEvent(long generation, String to, String from, int redirectHops, long durationMs) {}

    /** Event emitted on a non-exceptional failure. */
    record NavigationAbortedEvent(long generation, String to, String from, String kind) {}

    /** Event emitted when a navigation fails with an error. */
    record NavigationFailedEvent(long generation, String to, String from, String errorDetail) {}
}
