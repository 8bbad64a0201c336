package io.waypoint.core.model;

import io.waypoint.core.navigation.NavigationGuard;
import io.waypoint.core.spi.ComponentLoader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * User-facing route declaration, possibly with nested children. Child paths without a leading {@code /}
 * are relative to the parent.
 */
public record RouteDefinition(
        String path,
        String name,
        Map<String, Object> meta,
        ComponentLoader component,
        List<String> aliases,
        RouteRedirect redirect,
        List<NavigationGuard> beforeEnter,
        List<NavigationGuard> beforeLeave,
        List<RouteDefinition> children) {

    public RouteDefinition {
        Objects.requireNonNull(path, "path must not be null");
        meta = meta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        beforeEnter = beforeEnter == null ? List.of() : List.copyOf(beforeEnter);
        beforeLeave = beforeLeave == null ? List.of() : List.copyOf(beforeLeave);
        children = children == null ? List.of() : List.copyOf(children);
    }

    /** Shorthand for a plain path with no options. */
    public static RouteDefinition of(String path) {
        return builder(path).build();
    }

    public static Builder builder(String path) {
        return new Builder(path);
    }

    /** Builder for {@link RouteDefinition}. */
    public static final class Builder {
        private final String path;
        private String name;
        private final Map<String, Object> meta = new LinkedHashMap<>();
        private ComponentLoader component;
        private final List<String> aliases = new ArrayList<>();
        private RouteRedirect redirect;
        private final List<NavigationGuard> beforeEnter = new ArrayList<>();
        private final List<NavigationGuard> beforeLeave = new ArrayList<>();
        private final List<RouteDefinition> children = new ArrayList<>();

        private Builder(String path) {
            this.path = path;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder meta(String key, Object value) {
            this.meta.put(key, value);
            return this;
        }

        public Builder meta(Map<String, Object> meta) {
            this.meta.putAll(meta);
            return this;
        }

        public Builder component(ComponentLoader component) {
            this.component = component;
            return this;
        }

        public Builder alias(String alias) {
            this.aliases.add(alias);
            return this;
        }

        /** Redirects to a location string; {@code null} clears the redirect. */
        public Builder redirect(String redirect) {
            this.redirect = redirect == null ? null : RouteRedirect.to(redirect);
            return this;
        }

        /** Redirects to a path or named location. */
        public Builder redirect(RawLocation redirect) {
            this.redirect = RouteRedirect.to(redirect);
            return this;
        }

        /** Redirects to a location computed from the matched one. */
        public Builder redirect(Function<ResolvedLocation, RawLocation> redirect) {
            this.redirect = RouteRedirect.computed(redirect);
            return this;
        }

        public Builder beforeEnter(NavigationGuard guard) {
            this.beforeEnter.add(guard);
            return this;
        }

        public Builder beforeLeave(NavigationGuard guard) {
            this.beforeLeave.add(guard);
            return this;
        }

        public Builder child(RouteDefinition child) {
            this.children.add(child);
            return this;
        }

        public RouteDefinition build() {
            return new RouteDefinition(
                    path, name, meta, component, aliases, redirect, beforeEnter, beforeLeave, children);
        }
    }
}
