package io.waypoint.core.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Redirect attached to a route record. Matching the record sends the navigation to {@link #target} instead.
 *
 * <p>
 * A target without its own query or hash inherits those of the matched location.
 */
@FunctionalInterface
public interface RouteRedirect {

    /**
     * @param to the location that matched the redirecting record
     * @return the location to navigate to instead
     */
    RawLocation target(ResolvedLocation to);

    /** Redirect to a fixed location string such as {@code /login?next=home}. */
    static RouteRedirect to(String location) {
        return new Fixed(RawLocation.parse(location));
    }

    /** Redirect to a fixed path or named location. */
    static RouteRedirect to(RawLocation location) {
        return new Fixed(location);
    }

    /** Redirect computed from the matched location, e.g. to carry its params over to a named route. */
    static RouteRedirect computed(Function<ResolvedLocation, RawLocation> function) {
        return new Computed(function);
    }

    /** A redirect to the same location every time. */
    record Fixed(RawLocation location) implements RouteRedirect {

        public Fixed {
            Objects.requireNonNull(location, "location must not be null");
        }

        @Override
        public RawLocation target(ResolvedLocation to) {
            return location;
        }
    }

    /** A redirect derived from the matched location. */
    record Computed(Function<ResolvedLocation, RawLocation> function) implements RouteRedirect {

        public Computed {
            Objects.requireNonNull(function, "function must not be null");
        }

        /**
         * @throws IllegalStateException if the function returns {@code null}
         */
        @Override
        public RawLocation target(ResolvedLocation to) {
            RawLocation target = function.apply(to);
            if (target == null) {
                throw new IllegalStateException("Redirect function for '" + to.fullPath() + "' returned null");
            }
            return target;
        }
    }
}
