package io.waypoint.core.spi;

/** Handle returned by listener and hook registrations. Removing twice is a no-op. */
@FunctionalInterface
public interface Registration {

    void remove();
}
