package io.waypoint.core.navigation;

import io.waypoint.core.model.ResolvedLocation;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Adapters from the supported guard calling conventions to {@link NavigationGuard}. */
public final class Guards {

    private static final Logger LOG = LoggerFactory.getLogger(Guards.class);

    private Guards() {}

    /** A guard that returns its verdict directly. */
    @FunctionalInterface
    public interface SyncGuard {
        GuardResult check(ResolvedLocation to, ResolvedLocation from);
    }

    /** A guard that reports its verdict through a {@link GuardNext} continuation, possibly later. */
    @FunctionalInterface
    public interface CallbackGuard {
        void check(ResolvedLocation to, ResolvedLocation from, GuardNext next);
    }

    public static NavigationGuard sync(SyncGuard guard) {
        return (to, from) -> CompletableFuture.completedFuture(guard.check(to, from));
    }

    public static NavigationGuard callback(CallbackGuard guard) {
        return (to, from) -> {
            CompletableFuture<GuardResult> result = new CompletableFuture<>();
            guard.check(to, from, new FutureNext(result));
            return result;
        };
    }

    /** A guard that always aborts. */
    public static NavigationGuard deny() {
        return sync((to, from) -> GuardResult.abort());
    }

    /** A guard that always redirects to the given location. */
    public static NavigationGuard redirectTo(String location) {
        return sync((to, from) -> GuardResult.redirect(location));
    }

    private static final class FutureNext implements GuardNext {
        private final CompletableFuture<GuardResult> result;
        private final AtomicBoolean called = new AtomicBoolean();

        FutureNext(CompletableFuture<GuardResult> result) {
            this.result = result;
        }

        @Override
        public void proceed() {
            complete(GuardResult.proceed());
        }

        @Override
        public void abort() {
            complete(GuardResult.abort());
        }

        @Override
        public void redirect(String location) {
            complete(GuardResult.redirect(location));
        }

        @Override
        public void error(Throwable error) {
            complete(GuardResult.error(error));
        }

        private void complete(GuardResult verdict) {
            if (!called.compareAndSet(false, true)) {
                LOG.warn("Guard continuation called more than once; ignoring {}", verdict);
                return;
            }
            result.complete(verdict);
        }
    }
}
