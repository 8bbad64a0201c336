package io.waypoint.core.navigation;

import io.waypoint.core.model.RawLocation;
import io.waypoint.core.model.ResolvedLocation;

/** Resolves navigation targets. Unmatched targets resolve to an unmatched location. */
@FunctionalInterface
public interface LocationResolver {

    /**
     * @throws IllegalArgumentException for a named location whose route is unknown or whose params are
     *                                  incomplete
     */
    ResolvedLocation resolve(RawLocation raw);
}
