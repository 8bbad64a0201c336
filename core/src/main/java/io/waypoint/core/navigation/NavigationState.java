package io.waypoint.core.navigation;

/**
 * Pipeline state. A followed redirect keeps the navigation {@code PENDING}; {@code REDIRECTED} is terminal
 * and only reached when redirects are not followed. Duplicated navigations end {@code ABORTED}.
 */
public enum NavigationState {
    IDLE,
    PENDING,
    CONFIRMED,
    ABORTED,
    REDIRECTED,
    FAILED
}
