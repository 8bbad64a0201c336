package io.waypoint.core.navigation;

import io.waypoint.core.model.ResolvedLocation;
import io.waypoint.core.spi.Registration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Observable holder of the committed location. Subscribers are notified on every commit. */
public final class CurrentLocation {

    private static final Logger LOG = LoggerFactory.getLogger(CurrentLocation.class);

    private volatile ResolvedLocation value = ResolvedLocation.START;
    private final List<Consumer<ResolvedLocation>> subscribers = new CopyOnWriteArrayList<>();

    public ResolvedLocation get() {
        return value;
    }

    void set(ResolvedLocation location) {
        value = Objects.requireNonNull(location, "location must not be null");
        for (Consumer<ResolvedLocation> subscriber : subscribers) {
            try {
                subscriber.accept(location);
            } catch (Exception e) {
                LOG.warn("Current-location subscriber failed", e);
            }
        }
    }

    public Registration subscribe(Consumer<ResolvedLocation> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber must not be null");
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }
}
