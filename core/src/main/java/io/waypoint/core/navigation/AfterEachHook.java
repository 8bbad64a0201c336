package io.waypoint.core.navigation;

import io.waypoint.core.model.ResolvedLocation;

/** Runs after a navigation was committed. Failures are logged and never undo the navigation. */
@FunctionalInterface
public interface AfterEachHook {

    void afterEach(ResolvedLocation to, ResolvedLocation from);
}
