package io.waypoint.core.navigation;

/** Continuation handed to callback-style guards. Only the first call counts. */
public interface GuardNext {

    void proceed();

    void abort();

    void redirect(String location);

    void error(Throwable error);
}
