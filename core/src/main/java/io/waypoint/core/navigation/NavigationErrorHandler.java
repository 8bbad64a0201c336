package io.waypoint.core.navigation;

import io.waypoint.core.error.NavigationException;

/** Fire-and-forget notification of a failed navigation. */
@FunctionalInterface
public interface NavigationErrorHandler {

    void onError(NavigationException error);
}
