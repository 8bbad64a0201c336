package io.waypoint.core.router;

import io.waypoint.core.cache.CacheStats;
import io.waypoint.core.matcher.Hotspot;
import io.waypoint.core.matcher.MatcherRegistry;
import io.waypoint.core.model.FailureKind;
import io.waypoint.core.model.MatchResult;
import io.waypoint.core.model.NavigationFailure;
import io.waypoint.core.model.NavigationResult;
import io.waypoint.core.model.NavigationTrigger;
import io.waypoint.core.model.RawLocation;
import io.waypoint.core.model.ResolvedLocation;
import io.waypoint.core.model.RouteDefinition;
import io.waypoint.core.model.RouteRecord;
import io.waypoint.core.navigation.AfterEachHook;
import io.waypoint.core.navigation.CurrentLocation;
import io.waypoint.core.navigation.HookRegistry;
import io.waypoint.core.navigation.NavigationErrorHandler;
import io.waypoint.core.navigation.NavigationGuard;
import io.waypoint.core.navigation.NavigationPipeline;
import io.waypoint.core.navigation.NavigationState;
import io.waypoint.core.pattern.PathSegments;
import io.waypoint.core.spi.HistoryAdapter;
import io.waypoint.core.spi.Registration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composition root binding a {@link MatcherRegistry}, a {@link NavigationPipeline} and one
 * {@link HistoryAdapter}. There is no global router; every consumer receives its instance explicitly.
 *
 * <p>
 * Typical use:
 *
 * <pre>{@code
 * Router router = new Router(RouterOptions.DEFAULT, history);
 * router.addRoute(RouteDefinition.builder("/user/:id").name("user").build());
 * router.start().join();
 * router.push("/user/42").join();
 * }</pre>
 *
 * <p>
 * Host-initiated moves ({@code back}, {@code forward}, {@code go}) arrive as pop events and run through
 * the same pipeline. A pop that is aborted or fails is undone with the inverse {@code go}.
 */
public final class Router implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Router.class);

    private final MatcherRegistry matcher;
    private final HistoryAdapter history;
    private final HookRegistry hooks = new HookRegistry();
    private final CurrentLocation current = new CurrentLocation();
    private final NavigationPipeline pipeline;
    private final Registration historyRegistration;
    private final CompletableFuture<ResolvedLocation> ready = new CompletableFuture<>();
    private final Queue<CompletableFuture<NavigationResult>> pendingMoves = new ConcurrentLinkedQueue<>();
    private final AtomicInteger suppressedPops = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();

    public Router(RouterOptions options, HistoryAdapter history) {
        Objects.requireNonNull(options, "options must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.matcher = new MatcherRegistry(options.matcher());
        this.pipeline =
                new NavigationPipeline(this::resolve, history, hooks, current, options.pipeline(), options.listener());
        current.subscribe(ready::complete);
        this.historyRegistration = history.listen(this::onPop);
    }

    // --- Registration ---

    /**
     * Declares a route group after the existing ones. Groups are matched in creation order.
     *
     * @return {@code false} if the group already existed
     */
    public boolean createGroup(String name) {
        return matcher.createGroup(name);
    }

    public RouteRecord addRoute(RouteDefinition definition) {
        return matcher.addRoute(definition);
    }

    public RouteRecord addRoute(String group, RouteDefinition definition) {
        return matcher.addRoute(group, definition);
    }

    public RouteRecord addChildRoute(String parentName, RouteDefinition definition) {
        return matcher.addChildRoute(parentName, definition);
    }

    public boolean removeRoute(long id) {
        return matcher.removeRoute(id);
    }

    public boolean removeRoute(String name) {
        return matcher.removeRoute(name);
    }

    public boolean hasRoute(String name) {
        return matcher.hasRoute(name);
    }

    public List<RouteRecord> getRoutes() {
        return matcher.getRoutes();
    }

    // --- Resolution ---

    /** Resolves a location string such as {@code /user/42?tab=files#top}. */
    public ResolvedLocation resolve(String location) {
        return resolve(RawLocation.parse(location));
    }

    /**
     * Resolves a raw location. An unmatched path yields an unmatched location rather than an error.
     *
     * @throws IllegalArgumentException if a named location's route is unknown or a required param is missing
     */
    public ResolvedLocation resolve(RawLocation raw) {
        Objects.requireNonNull(raw, "raw must not be null");
        String path = raw.isNamed() ? matcher.buildPath(raw.name(), raw.params()) : raw.path();
        String normalized = PathSegments.normalize(path);
        Optional<MatchResult> match = matcher.match(normalized);
        if (match.isEmpty()) {
            return ResolvedLocation.unmatched(normalized, raw.query(), raw.hash());
        }
        MatchResult m = match.get();
        return ResolvedLocation.of(normalized, m.params(), raw.query(), raw.hash(), m.matchedChain());
    }

    // --- Navigation ---

    /** Performs the initial navigation to the history adapter's current location. */
    public CompletableFuture<NavigationResult> start() {
        return pipeline.navigate(RawLocation.parse(history.current()), NavigationTrigger.REPLACE, null);
    }

    /** Completes with the first committed location. */
    public CompletableFuture<ResolvedLocation> isReady() {
        return ready.copy();
    }

    public CompletableFuture<NavigationResult> push(String location) {
        return push(RawLocation.parse(location), null);
    }

    public CompletableFuture<NavigationResult> push(RawLocation location, Object state) {
        return pipeline.navigate(location, NavigationTrigger.PUSH, state);
    }

    public CompletableFuture<NavigationResult> replace(String location) {
        return replace(RawLocation.parse(location), null);
    }

    public CompletableFuture<NavigationResult> replace(RawLocation location, Object state) {
        return pipeline.navigate(location, NavigationTrigger.REPLACE, state);
    }

    /**
     * Moves through history. Completes with the outcome of the resulting pop navigation, with
     * {@link FailureKind#DUPLICATED} for {@code go(0)}, or with {@link FailureKind#CANCELLED} if the move is
     * out of range.
     */
    public CompletableFuture<NavigationResult> go(int delta) {
        ResolvedLocation here = current.get();
        if (delta == 0) {
            return CompletableFuture.completedFuture(
                    NavigationResult.failure(new NavigationFailure(FailureKind.DUPLICATED, here, here)));
        }
        CompletableFuture<NavigationResult> outcome = new CompletableFuture<>();
        pendingMoves.add(outcome);
        boolean moved;
        try {
            moved = history.go(delta);
        } catch (RuntimeException e) {
            pendingMoves.remove(outcome);
            throw e;
        }
        if (!moved) {
            pendingMoves.remove(outcome);
            LOG.debug("History move by {} is out of range", delta);
            outcome.complete(NavigationResult.failure(new NavigationFailure(FailureKind.CANCELLED, here, here)));
        }
        return outcome;
    }

    public CompletableFuture<NavigationResult> back() {
        return go(-1);
    }

    public CompletableFuture<NavigationResult> forward() {
        return go(1);
    }

    private void onPop(String to, String from, int delta) {
        if (suppressedPops.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            LOG.debug("Ignoring pop to '{}' caused by a revert", to);
            return;
        }
        CompletableFuture<NavigationResult> waiter = pendingMoves.poll();
        CompletableFuture<NavigationResult> outcome = pipeline.navigate(RawLocation.parse(to), NavigationTrigger.POP, null);
        outcome.whenComplete((result, error) -> {
            if (delta != 0 && needsRevert(result, error)) {
                LOG.debug("Reverting pop to '{}' by {}", to, -delta);
                suppressedPops.incrementAndGet();
                if (!history.go(-delta)) {
                    suppressedPops.decrementAndGet();
                }
            }
            if (waiter != null) {
                if (error != null) {
                    waiter.completeExceptionally(error instanceof CompletionException && error.getCause() != null
                            ? error.getCause()
                            : error);
                } else {
                    waiter.complete(result);
                }
            }
        });
    }

    private static boolean needsRevert(NavigationResult result, Throwable error) {
        if (error != null) {
            return true;
        }
        return !result.isSuccess() && !result.isFailure(FailureKind.CANCELLED);
    }

    // --- Hooks ---

    public Registration beforeEach(NavigationGuard guard) {
        return hooks.addBeforeEach(guard);
    }

    public Registration beforeResolve(NavigationGuard guard) {
        return hooks.addBeforeResolve(guard);
    }

    public Registration afterEach(AfterEachHook hook) {
        return hooks.addAfterEach(hook);
    }

    public Registration onError(NavigationErrorHandler handler) {
        return hooks.addErrorHandler(handler);
    }

    // --- State ---

    public ResolvedLocation currentLocation() {
        return current.get();
    }

    /** Subscribes to committed location changes. */
    public Registration subscribe(Consumer<ResolvedLocation> subscriber) {
        return current.subscribe(subscriber);
    }

    public NavigationState navigationState() {
        return pipeline.state();
    }

    public CacheStats cacheStats() {
        return matcher.cacheStats();
    }

    public List<Hotspot> hotspots(int limit) {
        return matcher.hotspots(limit);
    }

    /** Stops listening to the history adapter. Pending history moves complete as cancelled. */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        historyRegistration.remove();
        ResolvedLocation here = current.get();
        CompletableFuture<NavigationResult> pending;
        while ((pending = pendingMoves.poll()) != null) {
            pending.complete(NavigationResult.failure(new NavigationFailure(FailureKind.CANCELLED, here, here)));
        }
    }
}
