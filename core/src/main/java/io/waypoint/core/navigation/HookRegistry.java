package io.waypoint.core.navigation;

import io.waypoint.core.spi.Registration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Global guard and hook lists, in registration order. Snapshots are taken when a navigation collects its
 * guards, so registering or removing hooks mid-navigation never affects the navigation in flight.
 */
public final class HookRegistry {

    private final List<NavigationGuard> beforeEach = new CopyOnWriteArrayList<>();
    private final List<NavigationGuard> beforeResolve = new CopyOnWriteArrayList<>();
    private final List<AfterEachHook> afterEach = new CopyOnWriteArrayList<>();
    private final List<NavigationErrorHandler> errorHandlers = new CopyOnWriteArrayList<>();

    public Registration addBeforeEach(NavigationGuard guard) {
        return add(beforeEach, guard);
    }

    public Registration addBeforeResolve(NavigationGuard guard) {
        return add(beforeResolve, guard);
    }

    public Registration addAfterEach(AfterEachHook hook) {
        return add(afterEach, hook);
    }

    public Registration addErrorHandler(NavigationErrorHandler handler) {
        return add(errorHandlers, handler);
    }

    public List<NavigationGuard> beforeEach() {
        return List.copyOf(beforeEach);
    }

    public List<NavigationGuard> beforeResolve() {
        return List.copyOf(beforeResolve);
    }

    public List<AfterEachHook> afterEach() {
        return List.copyOf(afterEach);
    }

    public List<NavigationErrorHandler> errorHandlers() {
        return List.copyOf(errorHandlers);
    }

    private static <T> Registration add(List<T> list, T item) {
        Objects.requireNonNull(item, "hook must not be null");
        AtomicBoolean removed = new AtomicBoolean();
        list.add(item);
        return () -> {
            if (removed.compareAndSet(false, true)) {
                list.remove(item);
            }
        };
    }
}
