package io.waypoint.core.model;

/** What started a navigation. */
public enum NavigationTrigger {
    PUSH,
    REPLACE,
    POP
}
