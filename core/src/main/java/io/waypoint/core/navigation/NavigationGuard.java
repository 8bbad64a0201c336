package io.waypoint.core.navigation;

import io.waypoint.core.model.ResolvedLocation;
import java.util.concurrent.CompletableFuture;

/**
 * The single internal guard contract. Synchronous and callback-style guards are adapted to it by
 * {@link Guards}. A guard that throws, returns {@code null}, or completes its future exceptionally is
 * treated as {@link GuardResult#error(Throwable)}.
 */
@FunctionalInterface
public interface NavigationGuard {

    CompletableFuture<GuardResult> check(ResolvedLocation to, ResolvedLocation from);
}
