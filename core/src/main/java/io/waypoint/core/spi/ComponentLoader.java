package io.waypoint.core.spi;

import java.util.concurrent.CompletableFuture;

/** Asynchronous component loader attached to a route record. Never invoked by the core. */
@FunctionalInterface
public interface ComponentLoader {

    CompletableFuture<ComponentDescriptor> load();
}
