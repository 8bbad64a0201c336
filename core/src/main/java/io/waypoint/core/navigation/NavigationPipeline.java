package io.waypoint.core.navigation;

import io.waypoint.core.error.GuardException;
import io.waypoint.core.error.HistoryCommitException;
import io.waypoint.core.error.MatchNotFoundException;
import io.waypoint.core.error.NavigationException;
import io.waypoint.core.error.RedirectLoopException;
import io.waypoint.core.model.FailureKind;
import io.waypoint.core.model.NavigationFailure;
import io.waypoint.core.model.NavigationRequest;
import io.waypoint.core.model.NavigationResult;
import io.waypoint.core.model.NavigationTrigger;
import io.waypoint.core.model.RawLocation;
import io.waypoint.core.model.ResolvedLocation;
import io.waypoint.core.model.RouteRecord;
import io.waypoint.core.model.RouteRedirect;
import io.waypoint.core.spi.HistoryAdapter;
import io.waypoint.core.spi.NavigationListener;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a requested navigation into a committed location change, a non-exceptional
 * {@link NavigationFailure}, or an error.
 *
 * <p>
 * Each navigation receives a generation from a process-wide counter. Guards run strictly one after another:
 * global {@code beforeEach}, leave guards of records no longer matched (leaf to root), enter guards of newly
 * matched records (root to leaf), then global {@code beforeResolve}. Records matched both before and after
 * the navigation are reused and run neither.
 *
 * <p>
 * Only the newest generation may reach a terminal state. A navigation overtaken by a newer one is discarded
 * silently as {@link FailureKind#CANCELLED}: no history mutation, no {@code afterEach}, no error handler.
 * There is no cancellation signal; an in-flight guard simply finishes and its verdict is ignored.
 */
public final class NavigationPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(NavigationPipeline.class);

    private static final AtomicLong GENERATIONS = new AtomicLong();

    /** {@link GuardException#guardPhase()} reported when a record's redirect function fails. */
    static final String REDIRECT_PHASE = "redirect";

    private final LocationResolver resolver;
    private final HistoryAdapter history;
    private final HookRegistry hooks;
    private final CurrentLocation current;
    private final PipelineOptions options;
    private final NavigationListener listener;

    private final AtomicLong latest = new AtomicLong();
    private volatile NavigationState state = NavigationState.IDLE;

    /**
     * @param listener telemetry listener, or {@code null}
     */
    public NavigationPipeline(
            LocationResolver resolver,
            HistoryAdapter history,
            HookRegistry hooks,
            CurrentLocation current,
            PipelineOptions options,
            NavigationListener listener) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.hooks = Objects.requireNonNull(hooks, "hooks must not be null");
        this.current = Objects.requireNonNull(current, "current must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.listener = listener;
    }

    /** State of the most recently started navigation. */
    public NavigationState state() {
        return state;
    }

    /** Generation of the most recently started navigation, {@code 0} before the first one. */
    public long latestGeneration() {
        return latest.get();
    }

    /**
     * Starts a navigation.
     *
     * @param target       requested target
     * @param trigger      push, replace, or pop (the host already moved; nothing is written to history)
     * @param historyState opaque state stored with the new history entry, may be {@code null}
     * @return the outcome; completes exceptionally with a {@link NavigationException} on errors
     */
    public CompletableFuture<NavigationResult> navigate(
            RawLocation target, NavigationTrigger trigger, Object historyState) {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(trigger, "trigger must not be null");
        long generation = GENERATIONS.incrementAndGet();
        latest.accumulateAndGet(generation, Math::max);
        state = NavigationState.PENDING;
        Attempt attempt = new Attempt(new NavigationRequest(current.get(), target, trigger, generation, historyState));
        LOG.debug("Navigation {} started: {} -> {} ({})", generation, attempt.from().fullPath(), target, trigger);
        notifyStarted(attempt, target);
        return run(attempt, target, trigger);
    }

    private CompletableFuture<NavigationResult> run(Attempt a, RawLocation target, NavigationTrigger trigger) {
        ResolvedLocation to;
        try {
            to = resolver.resolve(target);
        } catch (IllegalArgumentException e) {
            return fail(
                    a,
                    new MatchNotFoundException(
                            e.getMessage(), e, a.generation(), target.toString(), a.from().fullPath()));
        }
        if (!to.matched()) {
            return fail(
                    a,
                    new MatchNotFoundException(
                            "No route matches '" + to.fullPath() + "'",
                            a.generation(),
                            to.fullPath(),
                            a.from().fullPath()));
        }
        if (a.firstTarget == null) {
            a.firstTarget = to;
        }
        RouteRecord leaf = to.record();
        if (leaf.redirect() != null) {
            RawLocation redirectTarget;
            try {
                redirectTarget = recordRedirect(leaf.redirect(), to);
            } catch (RuntimeException e) {
                return fail(
                        a,
                        new GuardException(
                                "Redirect of route '" + leaf.path() + "' failed: " + e.getMessage(),
                                e,
                                a.generation(),
                                to.fullPath(),
                                a.from().fullPath(),
                                REDIRECT_PHASE));
            }
            return redirect(a, to, redirectTarget, trigger);
        }
        if (trigger != NavigationTrigger.POP
                && a.from().matched()
                && to.fullPath().equals(a.from().fullPath())) {
            return finishWithFailure(a, to, FailureKind.DUPLICATED);
        }
        List<StagedGuard> guards = collectGuards(to, a.from());
        return runGuards(a, to, guards, 0).thenCompose(verdict -> conclude(a, to, trigger, verdict));
    }

    private List<StagedGuard> collectGuards(ResolvedLocation to, ResolvedLocation from) {
        List<StagedGuard> staged = new ArrayList<>();
        for (NavigationGuard g : hooks.beforeEach()) {
            staged.add(new StagedGuard(GuardPhase.BEFORE_EACH, g));
        }
        Set<Long> toOrigins = origins(to.matchedChain());
        Set<Long> fromOrigins = origins(from.matchedChain());
        List<RouteRecord> fromChain = from.matchedChain();
        for (int i = fromChain.size() - 1; i >= 0; i--) {
            RouteRecord record = fromChain.get(i);
            if (!toOrigins.contains(record.originId())) {
                for (NavigationGuard g : record.beforeLeave()) {
                    staged.add(new StagedGuard(GuardPhase.LEAVE, g));
                }
            }
        }
        for (RouteRecord record : to.matchedChain()) {
            if (!fromOrigins.contains(record.originId())) {
                for (NavigationGuard g : record.beforeEnter()) {
                    staged.add(new StagedGuard(GuardPhase.ENTER, g));
                }
            }
        }
        for (NavigationGuard g : hooks.beforeResolve()) {
            staged.add(new StagedGuard(GuardPhase.BEFORE_RESOLVE, g));
        }
        return staged;
    }

    private static Set<Long> origins(List<RouteRecord> chain) {
        Set<Long> ids = new HashSet<>();
        for (RouteRecord r : chain) {
            ids.add(r.originId());
        }
        return ids;
    }

    /**
     * Runs guards from {@code start} in order. Already-completed guard futures are consumed in a loop;
     * only a genuinely pending guard suspends the walk.
     */
    private CompletableFuture<Verdict> runGuards(
            Attempt a, ResolvedLocation to, List<StagedGuard> guards, int start) {
        for (int i = start; i < guards.size(); i++) {
            if (isStale(a)) {
                return CompletableFuture.completedFuture(Verdict.PROCEED);
            }
            StagedGuard staged = guards.get(i);
            CompletableFuture<GuardResult> pending = invoke(staged.guard(), to, a.from());
            if (pending.isDone()) {
                GuardResult result = pending.join();
                if (!result.isProceed()) {
                    return CompletableFuture.completedFuture(new Verdict(staged.phase(), result));
                }
                continue;
            }
            int next = i + 1;
            return pending.thenCompose(result -> result.isProceed()
                    ? runGuards(a, to, guards, next)
                    : CompletableFuture.completedFuture(new Verdict(staged.phase(), result)));
        }
        return CompletableFuture.completedFuture(Verdict.PROCEED);
    }

    /** Calls a guard and folds every failure mode into a {@link GuardResult}. Never completes exceptionally. */
    private static CompletableFuture<GuardResult> invoke(
            NavigationGuard guard, ResolvedLocation to, ResolvedLocation from) {
        CompletableFuture<GuardResult> raw;
        try {
            raw = guard.check(to, from);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(GuardResult.error(e));
        }
        if (raw == null) {
            return CompletableFuture.completedFuture(
                    GuardResult.error(new IllegalStateException("Guard returned a null future")));
        }
        return raw.handle((result, ex) -> {
            if (ex != null) {
                return GuardResult.error(unwrap(ex));
            }
            return result != null
                    ? result
                    : GuardResult.error(new IllegalStateException("Guard completed with a null result"));
        });
    }

    private CompletableFuture<NavigationResult> conclude(
            Attempt a, ResolvedLocation to, NavigationTrigger trigger, Verdict verdict) {
        if (isStale(a)) {
            return cancelled(a, to);
        }
        GuardResult result = verdict.result();
        return switch (result.type()) {
            case CONTINUE -> commit(a, to, trigger);
            case ABORT -> finishWithFailure(a, to, FailureKind.ABORTED);
            case REDIRECT -> redirect(a, to, result.redirectTarget(), trigger);
            case ERROR -> fail(
                    a,
                    new GuardException(
                            "Guard in phase '" + verdict.phase().label() + "' failed: "
                                    + result.error().getMessage(),
                            result.error(),
                            a.generation(),
                            to.fullPath(),
                            a.from().fullPath(),
                            verdict.phase().label()));
        };
    }

    private CompletableFuture<NavigationResult> redirect(
            Attempt a, ResolvedLocation to, RawLocation target, NavigationTrigger trigger) {
        if (isStale(a)) {
            return cancelled(a, to);
        }
        a.hops++;
        if (a.hops > options.maxRedirects()) {
            return fail(
                    a,
                    new RedirectLoopException(
                            "Navigation to '" + a.firstTarget.fullPath() + "' exceeded " + options.maxRedirects()
                                    + " redirects (last target '" + target + "')",
                            a.generation(),
                            to.fullPath(),
                            a.from().fullPath(),
                            options.maxRedirects()));
        }
        if (!options.followRedirects()) {
            ResolvedLocation redirected;
            try {
                redirected = resolver.resolve(target);
            } catch (IllegalArgumentException e) {
                return fail(
                        a,
                        new MatchNotFoundException(
                                e.getMessage(), e, a.generation(), target.toString(), a.from().fullPath()));
            }
            return finishWithFailure(a, redirected, FailureKind.REDIRECTED);
        }
        LOG.debug("Navigation {} redirected: {} -> {} (hop {})", a.generation(), to.fullPath(), target, a.hops);
        NavigationTrigger next = trigger == NavigationTrigger.POP ? NavigationTrigger.REPLACE : trigger;
        return run(a, target, next);
    }

    private CompletableFuture<NavigationResult> commit(Attempt a, ResolvedLocation to, NavigationTrigger trigger) {
        try {
            switch (trigger) {
                case PUSH -> history.push(to.fullPath(), a.request.state());
                case REPLACE -> history.replace(to.fullPath(), a.request.state());
                case POP -> {
                    // the host already moved
                }
            }
        } catch (RuntimeException e) {
            return fail(
                    a,
                    new HistoryCommitException(
                            "History adapter rejected " + trigger + " of '" + to.fullPath() + "'",
                            e,
                            a.generation(),
                            to.fullPath(),
                            a.from().fullPath()));
        }
        current.set(to);
        state = NavigationState.CONFIRMED;
        for (AfterEachHook hook : hooks.afterEach()) {
            try {
                hook.afterEach(to, a.from());
            } catch (Exception e) {
                LOG.warn("afterEach hook failed for navigation {} to '{}'", a.generation(), to.fullPath(), e);
            }
        }
        long durationMs = a.elapsedMs();
        LOG.atInfo()
                .addKeyValue("generation", a.generation())
                .addKeyValue("to", to.fullPath())
                .addKeyValue("from", a.from().fullPath())
                .addKeyValue("trigger", a.request.trigger().name())
                .addKeyValue("redirect_hops", a.hops)
                .addKeyValue("duration_ms", durationMs)
                .log("navigation.confirmed");
        notifyConfirmed(a, to, durationMs);
        ResolvedLocation redirectedFrom = a.hops > 0 ? a.firstTarget : null;
        return CompletableFuture.completedFuture(NavigationResult.success(to, redirectedFrom));
    }

    private CompletableFuture<NavigationResult> finishWithFailure(Attempt a, ResolvedLocation to, FailureKind kind) {
        if (isStale(a)) {
            return cancelled(a, to);
        }
        state = kind == FailureKind.REDIRECTED ? NavigationState.REDIRECTED : NavigationState.ABORTED;
        LOG.atInfo()
                .addKeyValue("generation", a.generation())
                .addKeyValue("to", to.fullPath())
                .addKeyValue("from", a.from().fullPath())
                .addKeyValue("kind", kind.name())
                .log("navigation.aborted");
        notifyAborted(a, to, kind);
        return CompletableFuture.completedFuture(
                NavigationResult.failure(new NavigationFailure(kind, a.from(), to)));
    }

    private CompletableFuture<NavigationResult> cancelled(Attempt a, ResolvedLocation to) {
        LOG.atDebug()
                .addKeyValue("generation", a.generation())
                .addKeyValue("latest", latest.get())
                .addKeyValue("to", to.fullPath())
                .log("navigation.cancelled");
        notifyAborted(a, to, FailureKind.CANCELLED);
        return CompletableFuture.completedFuture(
                NavigationResult.failure(new NavigationFailure(FailureKind.CANCELLED, a.from(), to)));
    }

    private CompletableFuture<NavigationResult> fail(Attempt a, NavigationException error) {
        if (isStale(a)) {
            ResolvedLocation target = ResolvedLocation.unmatched(error.toPath(), null, null);
            return cancelled(a, target);
        }
        state = NavigationState.FAILED;
        LOG.atWarn()
                .addKeyValue("generation", a.generation())
                .addKeyValue("to", error.toPath())
                .addKeyValue("from", error.fromPath())
                .addKeyValue("error", error.getClass().getSimpleName())
                .setCause(error)
                .log("navigation.failed");
        for (NavigationErrorHandler handler : hooks.errorHandlers()) {
            try {
                handler.onError(error);
            } catch (Exception e) {
                LOG.warn("Navigation error handler failed", e);
            }
        }
        notifyFailed(a, error);
        return CompletableFuture.failedFuture(error);
    }

    private boolean isStale(Attempt a) {
        return a.generation() != latest.get();
    }

    /** A record-level redirect keeps the query and hash of the original target unless it sets its own. */
    private static RawLocation recordRedirect(RouteRedirect redirect, ResolvedLocation to) {
        RawLocation target = redirect.target(to);
        if (target.query().isEmpty()) {
            target = target.withQuery(to.query());
        }
        if (target.hash().isEmpty()) {
            target = target.withHash(to.hash());
        }
        return target;
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable t = ex;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    // --- Telemetry ---

    private void notifyStarted(Attempt a, RawLocation target) {
        if (listener == null) return;
        try {
            listener.onNavigationStarted(new NavigationListener.NavigationStartedEvent(
                    a.generation(), target.toString(), a.from().fullPath(), a.request.trigger()));
        } catch (Exception e) {
            LOG.warn("NavigationListener.onNavigationStarted failed", e);
        }
    }

    private void notifyConfirmed(Attempt a, ResolvedLocation to, long durationMs) {
        if (listener == null) return;
        try {
            listener.onNavigationConfirmed(new NavigationListener.NavigationConfirmedEvent(
                    a.generation(), to.fullPath(), a.from().fullPath(), a.hops, durationMs));
        } catch (Exception e) {
            LOG.warn("NavigationListener.onNavigationConfirmed failed", e);
        }
    }

    private void notifyAborted(Attempt a, ResolvedLocation to, FailureKind kind) {
        if (listener == null) return;
        try {
            listener.onNavigationAborted(new NavigationListener.NavigationAbortedEvent(
                    a.generation(), to.fullPath(), a.from().fullPath(), kind.name()));
        } catch (Exception e) {
            LOG.warn("NavigationListener.onNavigationAborted failed", e);
        }
    }

    private void notifyFailed(Attempt a, NavigationException error) {
        if (listener == null) return;
        try {
            listener.onNavigationFailed(new NavigationListener.NavigationFailedEvent(
                    a.generation(), error.toPath(), a.from().fullPath(), error.getMessage()));
        } catch (Exception e) {
            LOG.warn("NavigationListener.onNavigationFailed failed", e);
        }
    }

    private record StagedGuard(GuardPhase phase, NavigationGuard guard) {}

    private record Verdict(GuardPhase phase, GuardResult result) {
        static final Verdict PROCEED = new Verdict(null, GuardResult.proceed());
    }

    /** Mutable per-navigation bookkeeping shared across redirect hops. */
    private static final class Attempt {
        final NavigationRequest request;
        final long startNanos = System.nanoTime();
        int hops;
        ResolvedLocation firstTarget;

        Attempt(NavigationRequest request) {
            this.request = request;
        }

        long generation() {
            return request.generation();
        }

        ResolvedLocation from() {
            return request.from();
        }

        long elapsedMs() {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        }
    }
}
