package io.waypoint.core.matcher;

import io.waypoint.core.cache.CacheStats;
import io.waypoint.core.cache.MatchCache;
import io.waypoint.core.error.DuplicateRouteException;
import io.waypoint.core.model.MatchResult;
import io.waypoint.core.model.RouteDefinition;
import io.waypoint.core.model.RouteRecord;
import io.waypoint.core.pattern.CompiledPattern;
import io.waypoint.core.pattern.PathCompiler;
import io.waypoint.core.pattern.PathSegments;
import io.waypoint.core.trie.RouteTrie;
import io.waypoint.core.trie.TrieMatch;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns every registered route: one {@link RouteTrie} per group, the record arena, the name index, the
 * shared {@link MatchCache} and hotspot counters.
 *
 * <p>
 * {@link #match(String)} tries the groups in creation order and returns the first hit. Registration is
 * all-or-nothing: a definition tree is compiled and checked for conflicts before anything is mutated, so a
 * malformed or conflicting definition leaves the registry untouched.
 *
 * <p>
 * The cache is a derived view: registration invalidates the cached paths a new pattern matches, removal
 * invalidates the removed path and every cached result that references a removed record. Disabling the
 * cache never changes a lookup's value.
 *
 * <p>
 * Methods synchronize on the registry. The monitor is reentrant, so a guard that resolves a path while an
 * outer call is in progress on the same thread is safe.
 */
public final class MatcherRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(MatcherRegistry.class);

    /** Group that always exists and receives routes registered without a group. */
    public static final String DEFAULT_GROUP = "default";

    private final MatcherOptions options;
    private final Map<String, RouteTrie> groups = new LinkedHashMap<>();
    private final Map<Long, RouteRecord> arena = new LinkedHashMap<>();
    private final Map<String, Long> names = new HashMap<>();
    private final MatchCache<Optional<MatchResult>> cache;
    private final Map<String, PathCounter> accessCounts = new HashMap<>();
    private long accessTick;
    private long nextId = 1;

    public MatcherRegistry(MatcherOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.cache = options.cacheEnabled() ? new MatchCache<>(options.cachePolicy()) : null;
        groups.put(DEFAULT_GROUP, new RouteTrie(DEFAULT_GROUP, options.caseSensitive()));
    }

    public MatcherOptions options() {
        return options;
    }

    /**
     * Creates an empty group after the existing ones.
     *
     * @return {@code false} if the group already existed
     */
    public synchronized boolean createGroup(String name) {
        Objects.requireNonNull(name, "group name must not be null");
        if (groups.containsKey(name)) {
            return false;
        }
        groups.put(name, new RouteTrie(name, options.caseSensitive()));
        return true;
    }

    /** Group names in match order. */
    public synchronized List<String> groups() {
        return List.copyOf(groups.keySet());
    }

    /** Registers a route tree in the default group. */
    public RouteRecord addRoute(RouteDefinition definition) {
        return addRoute(DEFAULT_GROUP, definition);
    }

    /**
     * Registers a route tree in a group, creating the group if needed. A route whose name is already
     * registered replaces the existing route and its descendants.
     *
     * @return the record created for the top-level definition
     * @throws io.waypoint.core.error.PatternCompileException if any pattern in the tree is malformed
     * @throws DuplicateRouteException if a pattern conflicts with an existing or sibling registration
     */
    public synchronized RouteRecord addRoute(String group, RouteDefinition definition) {
        Objects.requireNonNull(group, "group must not be null");
        Objects.requireNonNull(definition, "definition must not be null");
        return register(group, null, definition);
    }

    /**
     * Registers a route as a child of an existing named route, in the parent's group.
     *
     * @throws IllegalArgumentException if no route has that name
     */
    public synchronized RouteRecord addChildRoute(String parentName, RouteDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        RouteRecord parent = findByName(parentName)
                .orElseThrow(() -> new IllegalArgumentException("No route registered with name: '" + parentName + "'"));
        return register(parent.group(), parent, definition);
    }

    /**
     * Removes a record together with its descendants and aliases.
     *
     * @return {@code false} if no record has that id
     */
    public synchronized boolean removeRoute(long id) {
        if (!arena.containsKey(id)) {
            return false;
        }
        removeAll(subtree(Set.of(id)));
        return true;
    }

    /** Removes a named route together with its descendants and aliases. */
    public synchronized boolean removeRoute(String name) {
        Long id = names.get(name);
        return id != null && removeRoute(id);
    }

    /**
     * Matches a path (without query or hash) against all groups.
     *
     * @return the match, or empty if no route matches
     */
    public synchronized Optional<MatchResult> match(String path) {
        String key = PathSegments.normalize(path);
        trackAccess(key);
        if (cache == null) {
            return lookup(key);
        }
        Optional<MatchResult> cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        Optional<MatchResult> result = lookup(key);
        cache.put(key, result);
        return result;
    }

    /** O(1) lookup through the name index. */
    public synchronized Optional<RouteRecord> findByName(String name) {
        Long id = names.get(name);
        return id == null ? Optional.empty() : Optional.ofNullable(arena.get(id));
    }

    public synchronized Optional<RouteRecord> findById(long id) {
        return Optional.ofNullable(arena.get(id));
    }

    public synchronized boolean hasRoute(String name) {
        return names.containsKey(name);
    }

    /** Snapshot of all records, aliases included, in registration order. */
    public synchronized List<RouteRecord> getRoutes() {
        return List.copyOf(arena.values());
    }

    /** Records from the root to {@code record}, following parent ids through the arena. */
    public synchronized List<RouteRecord> chainOf(RouteRecord record) {
        List<RouteRecord> chain = new ArrayList<>();
        RouteRecord current = record;
        while (current != null) {
            chain.add(0, current);
            current = current.parentId() == null ? null : arena.get(current.parentId());
        }
        return chain;
    }

    /**
     * Builds the path of a named route.
     *
     * @throws IllegalArgumentException if the name is unknown or a required param is missing
     */
    public synchronized String buildPath(String name, Map<String, String> params) {
        RouteRecord record = findByName(name)
                .orElseThrow(() -> new IllegalArgumentException("No route registered with name: '" + name + "'"));
        return record.pattern().buildPath(params);
    }

    /**
     * The most frequently matched paths, most frequent first.
     *
     * @throws IllegalArgumentException if {@code limit} is negative
     */
    public synchronized List<Hotspot> hotspots(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got: " + limit);
        }
        List<Hotspot> all = new ArrayList<>();
        accessCounts.forEach((path, counter) -> all.add(new Hotspot(path, counter.hits)));
        all.sort(Comparator.comparingLong(Hotspot::count).reversed().thenComparing(Hotspot::path));
        return all.size() <= limit ? all : List.copyOf(all.subList(0, limit));
    }

    /** Cache counters; all zero when the cache is disabled. */
    public synchronized CacheStats cacheStats() {
        return cache == null ? new CacheStats(0, 0, 0, 0, 0, 0) : cache.stats();
    }

    public synchronized void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    // --- Registration ---

    private record Pending(long id, Long parentId, Long aliasOf, CompiledPattern pattern, RouteDefinition definition) {}

    private RouteRecord register(String group, RouteRecord parent, RouteDefinition definition) {
        List<Pending> plan = new ArrayList<>();
        long[] ids = {nextId};
        String parentPath = parent == null ? "/" : parent.path();
        Long parentId = parent == null ? null : parent.id();
        compile(definition, parentPath, parentId, plan, ids);

        Set<Long> replaced = replacedByName(plan);
        if (parent != null && replaced.contains(parent.id())) {
            throw new IllegalArgumentException(
                    "Route '" + definition.path() + "' would replace its own parent '" + parent.name() + "'");
        }
        checkConflicts(group, plan, replaced);

        if (!replaced.isEmpty()) {
            removeAll(replaced);
        }
        createGroup(group);
        RouteTrie trie = groups.get(group);
        for (Pending p : plan) {
            RouteRecord record = toRecord(group, p);
            trie.insert(record);
            arena.put(record.id(), record);
            if (p.aliasOf() == null && record.name() != null) {
                names.put(record.name(), record.id());
            }
            if (cache != null) {
                CompiledPattern pattern = p.pattern();
                cache.invalidateIf((key, value) -> pattern.matches(key, options.caseSensitive()));
            }
            LOG.atDebug()
                    .addKeyValue("id", record.id())
                    .addKeyValue("path", record.path())
                    .addKeyValue("name", record.name())
                    .addKeyValue("group", group)
                    .log("route.added");
        }
        nextId = ids[0];
        return arena.get(plan.get(0).id());
    }

    private static void compile(
            RouteDefinition definition, String parentPath, Long parentId, List<Pending> plan, long[] ids) {
        String path = PathCompiler.joinChild(parentPath, definition.path());
        CompiledPattern pattern = PathCompiler.compile(path);
        long id = ids[0]++;
        plan.add(new Pending(id, parentId, null, pattern, definition));
        for (String alias : definition.aliases()) {
            CompiledPattern aliasPattern = PathCompiler.compile(PathCompiler.joinChild(parentPath, alias));
            plan.add(new Pending(ids[0]++, parentId, id, aliasPattern, definition));
        }
        for (RouteDefinition child : definition.children()) {
            compile(child, path, id, plan, ids);
        }
    }

    private Set<Long> replacedByName(List<Pending> plan) {
        Set<String> seen = new HashSet<>();
        Set<Long> roots = new LinkedHashSet<>();
        for (Pending p : plan) {
            String name = p.definition().name();
            if (p.aliasOf() != null || name == null) {
                continue;
            }
            if (!seen.add(name)) {
                throw new DuplicateRouteException(
                        "Route name '" + name + "' is declared more than once", p.pattern().source(), -1);
            }
            Long existing = names.get(name);
            if (existing != null) {
                roots.add(existing);
            }
        }
        return roots.isEmpty() ? roots : subtree(roots);
    }

    private void checkConflicts(String group, List<Pending> plan, Set<Long> replaced) {
        RouteTrie trie = groups.get(group);
        Map<String, Pending> batch = new HashMap<>();
        for (Pending p : plan) {
            Pending sibling = batch.putIfAbsent(RouteTrie.nodeKey(p.pattern(), options.caseSensitive()), p);
            if (sibling != null) {
                throw new DuplicateRouteException(
                        "Route '" + p.pattern() + "' conflicts with '" + sibling.pattern() + "' in the same definition",
                        p.pattern().source(),
                        -1);
            }
            if (trie == null) {
                continue;
            }
            Optional<RouteRecord> existing = trie.find(p.pattern());
            if (existing.isPresent() && !replaced.contains(existing.get().id())) {
                throw new DuplicateRouteException(
                        "Route '" + p.pattern() + "' conflicts with existing route '" + existing.get().path()
                                + "' in group '" + group + "'",
                        p.pattern().source(),
                        existing.get().id());
            }
        }
    }

    private RouteRecord toRecord(String group, Pending p) {
        RouteDefinition d = p.definition();
        return new RouteRecord(
                p.id(),
                group,
                p.pattern(),
                d.name(),
                p.parentId(),
                p.aliasOf(),
                d.meta(),
                d.component(),
                d.redirect(),
                d.beforeEnter(),
                d.beforeLeave());
    }

    // --- Removal ---

    /** The given ids plus all their descendants and aliases. */
    private Set<Long> subtree(Set<Long> roots) {
        Set<Long> result = new LinkedHashSet<>(roots);
        boolean grew = true;
        while (grew) {
            grew = false;
            for (RouteRecord r : arena.values()) {
                if (result.contains(r.id())) {
                    continue;
                }
                boolean linked = (r.parentId() != null && result.contains(r.parentId()))
                        || (r.aliasOf() != null && result.contains(r.aliasOf()));
                if (linked) {
                    result.add(r.id());
                    grew = true;
                }
            }
        }
        return result;
    }

    private void removeAll(Set<Long> ids) {
        List<String> paths = new ArrayList<>();
        for (Long id : ids) {
            RouteRecord record = arena.remove(id);
            if (record == null) {
                continue;
            }
            groups.get(record.group()).remove(id);
            if (record.name() != null && id.equals(names.get(record.name()))) {
                names.remove(record.name());
            }
            paths.add(record.path());
            LOG.atDebug()
                    .addKeyValue("id", id)
                    .addKeyValue("path", record.path())
                    .addKeyValue("group", record.group())
                    .log("route.removed");
        }
        if (cache != null) {
            for (String path : paths) {
                cache.invalidate(path);
            }
            cache.invalidateIf((key, value) -> value.isPresent() && references(value.get(), ids));
        }
    }

    private static boolean references(MatchResult result, Set<Long> ids) {
        for (Long id : ids) {
            if (result.references(id)) {
                return true;
            }
        }
        return false;
    }

    // --- Matching ---

    private Optional<MatchResult> lookup(String normalizedPath) {
        List<String> segments = PathSegments.split(normalizedPath);
        for (RouteTrie trie : groups.values()) {
            Optional<TrieMatch> hit = trie.match(segments);
            if (hit.isPresent()) {
                TrieMatch m = hit.get();
                RouteRecord record = m.record();
                return Optional.of(new MatchResult(
                        record, record.pattern().bind(m.captures()), chainOf(record), m.score()));
            }
        }
        return Optional.empty();
    }

    /**
     * Counts a lookup. When {@link MatcherOptions#maxTrackedPaths()} distinct paths are tracked, a new path
     * first evicts the coldest tenth of them: lowest count first, least recently matched among equal counts.
     */
    private void trackAccess(String key) {
        accessTick++;
        PathCounter counter = accessCounts.get(key);
        if (counter == null) {
            if (options.maxTrackedPaths() == 0) {
                return;
            }
            if (accessCounts.size() >= options.maxTrackedPaths()) {
                evictColdPaths();
            }
            counter = new PathCounter();
            accessCounts.put(key, counter);
        }
        counter.hits++;
        counter.lastTick = accessTick;
    }

    private void evictColdPaths() {
        int evict = Math.max(1, accessCounts.size() / 10);
        List<Map.Entry<String, PathCounter>> coldest = new ArrayList<>(accessCounts.entrySet());
        coldest.sort(Comparator.comparingLong((Map.Entry<String, PathCounter> e) -> e.getValue().hits)
                .thenComparingLong(e -> e.getValue().lastTick));
        for (Map.Entry<String, PathCounter> e : List.copyOf(coldest.subList(0, evict))) {
            accessCounts.remove(e.getKey());
        }
        LOG.debug("Evicted {} cold paths from hotspot tracking", evict);
    }

    private static final class PathCounter {
        private long hits;
        private long lastTick;
    }
}
