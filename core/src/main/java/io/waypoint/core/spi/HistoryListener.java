package io.waypoint.core.spi;

/** Receives location changes that the host made on its own (back/forward, {@code go}). */
@FunctionalInterface
public interface HistoryListener {

    /**
     * Called after the host location moved.
     *
     * @param to    new full path
     * @param from  previous full path
     * @param delta signed number of entries moved, {@code 0} if unknown
     */
    void onPop(String to, String from, int delta);
}
