package io.waypoint.standalone.history;

import io.waypoint.core.spi.HistoryAdapter;
import io.waypoint.core.spi.HistoryListener;
import io.waypoint.core.spi.Registration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory {@link HistoryAdapter} for headless hosts and server-side rendering.
 *
 * <p>
 * Keeps a bounded stack of entries. {@link #push} and {@link #replace} only record the entry; listeners are
 * notified for {@link #go} moves alone, matching how a browser reports back/forward. When the stack is full
 * the oldest entry is dropped.
 *
 * <p>
 * Thread-safe. Listeners are called outside the lock, on the thread that called {@link #go}.
 */
public final class MemoryHistory implements HistoryAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(MemoryHistory.class);

    /** Default bound on the number of entries kept. */
    public static final int DEFAULT_MAX_ENTRIES = 100;

    private record Entry(String location, Object state) {}

    private final int maxEntries;
    private final List<Entry> entries = new ArrayList<>();
    private final List<HistoryListener> listeners = new CopyOnWriteArrayList<>();
    private int index;

    public MemoryHistory() {
        this("/", DEFAULT_MAX_ENTRIES);
    }

    /**
     * @param initialLocation location of the first entry
     * @param maxEntries      maximum number of entries kept, at least 1
     */
    public MemoryHistory(String initialLocation, int maxEntries) {
        Objects.requireNonNull(initialLocation, "initialLocation must not be null");
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1, got: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        entries.add(new Entry(initialLocation, null));
    }

    @Override
    public synchronized String current() {
        return entries.get(index).location();
    }

    /** State stored with the current entry, or {@code null}. */
    public synchronized Object state() {
        return entries.get(index).state();
    }

    @Override
    public synchronized void push(String location, Object state) {
        Objects.requireNonNull(location, "location must not be null");
        while (entries.size() > index + 1) {
            entries.remove(entries.size() - 1);
        }
        if (entries.size() >= maxEntries) {
            entries.remove(0);
            index--;
        }
        entries.add(new Entry(location, state));
        index++;
    }

    @Override
    public synchronized void replace(String location, Object state) {
        Objects.requireNonNull(location, "location must not be null");
        entries.set(index, new Entry(location, state));
    }

    @Override
    public boolean go(int delta) {
        String from;
        String to;
        synchronized (this) {
            int target = index + delta;
            if (delta == 0 || target < 0 || target >= entries.size()) {
                return false;
            }
            from = entries.get(index).location();
            index = target;
            to = entries.get(index).location();
        }
        LOG.debug("History moved by {}: {} -> {}", delta, from, to);
        for (HistoryListener listener : listeners) {
            listener.onPop(to, from, delta);
        }
        return true;
    }

    @Override
    public Registration listen(HistoryListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /** Number of entries currently kept. */
    public synchronized int size() {
        return entries.size();
    }

    /** Position of the current entry, {@code 0} being the oldest kept entry. */
    public synchronized int index() {
        return index;
    }

    /** Entry locations, oldest first. */
    public synchronized List<String> locations() {
        List<String> locations = new ArrayList<>(entries.size());
        for (Entry e : entries) {
            locations.add(e.location());
        }
        return locations;
    }
}
