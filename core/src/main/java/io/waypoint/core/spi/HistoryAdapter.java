package io.waypoint.core.spi;

/**
 * Abstraction over a host location-history provider (persistent paths, fragments, or an in-memory stack).
 * The router holds exactly one adapter and never branches on which variant it is.
 *
 * <p>
 * {@link #push} and {@link #replace} are issued by the router at commit time and must <b>not</b> notify
 * listeners. {@link #go} moves through the stack and notifies listeners once the move happened.
 */
public interface HistoryAdapter {

    /** Current full path including query and hash, e.g. {@code /user/42?tab=1#top}. */
    String current();

    /**
     * Adds a new entry after the current one, discarding any forward entries.
     *
     * @param location full path
     * @param state    opaque host state, may be {@code null}
     */
    void push(String location, Object state);

    /** Overwrites the current entry. */
    void replace(String location, Object state);

    /**
     * Moves {@code delta} entries through the stack.
     *
     * @return {@code false} if the move is out of range and nothing happened
     */
    boolean go(int delta);

    /** Registers a pop listener. */
    Registration listen(HistoryListener listener);
}
