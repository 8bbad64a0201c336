package io.waypoint.core.cache;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adaptive LRU cache keyed by normalized path.
 *
 * <p>
 * A hash map gives O(1) lookup; a doubly-linked list ordered most- to least-recently used gives O(1)
 * recency updates and eviction. Every {@link CachePolicy#checkInterval()} lookups the hit rate of the
 * window is compared with the policy thresholds and the capacity is grown or shrunk, always staying within
 * {@code [minCapacity, maxCapacity]}.
 *
 * <p>
 * The monitor is reentrant and no list iteration spans a call into foreign code: {@link #invalidateIf}
 * tests a snapshot of the entries, so a lookup issued re-entrantly (e.g. by a guard resolving a path)
 * cannot corrupt the recency list.
 *
 * @param <V> cached value type
 */
public final class MatchCache<V> {

    private static final Logger LOG = LoggerFactory.getLogger(MatchCache.class);

    private static final class Entry<V> {
        final String key;
        V value;
        Entry<V> prev;
        Entry<V> next;

        Entry(String key, V value) {
            this.key = key;
            this.value = value;
        }
    }

    private final CachePolicy policy;
    private final Map<String, Entry<V>> entries = new HashMap<>();
    private final Entry<V> head = new Entry<>(null, null);
    private final Entry<V> tail = new Entry<>(null, null);

    private int capacity;
    private long hits;
    private long misses;
    private long evictions;
    private long resizes;
    private int windowHits;
    private int windowLookups;

    public MatchCache(CachePolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.capacity = policy.initialCapacity();
        head.next = tail;
        tail.prev = head;
    }

    /** Returns the cached value and marks it most recently used, or {@code null} on a miss. */
    public synchronized V get(String key) {
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            misses++;
            recordLookup(false);
            return null;
        }
        hits++;
        unlink(entry);
        linkFirst(entry);
        recordLookup(true);
        return entry.value;
    }

    /** Stores a value as most recently used, evicting from the tail when over capacity. */
    public synchronized void put(String key, V value) {
        Objects.requireNonNull(key, "key must not be null");
        Entry<V> entry = entries.get(key);
        if (entry != null) {
            entry.value = value;
            unlink(entry);
            linkFirst(entry);
            return;
        }
        entry = new Entry<>(key, value);
        entries.put(key, entry);
        linkFirst(entry);
        evictOverflow();
    }

    /** Removes one key. */
    public synchronized boolean invalidate(String key) {
        Entry<V> entry = entries.remove(key);
        if (entry == null) {
            return false;
        }
        unlink(entry);
        return true;
    }

    /**
     * Removes every entry for which the predicate holds.
     *
     * @return number of removed entries
     */
    public synchronized int invalidateIf(BiPredicate<String, V> predicate) {
        List<Entry<V>> snapshot = new ArrayList<>(entries.values());
        int removed = 0;
        for (Entry<V> e : snapshot) {
            if (predicate.test(e.key, e.value) && entries.remove(e.key, e)) {
                unlink(e);
                removed++;
            }
        }
        return removed;
    }

    public synchronized void clear() {
        entries.clear();
        head.next = tail;
        tail.prev = head;
    }

    /**
     * Sets the capacity, clamped to the policy bounds, evicting least-recently-used entries if needed.
     *
     * @return the effective capacity
     */
    public synchronized int resize(int newCapacity) {
        capacity = Math.max(policy.minCapacity(), Math.min(policy.maxCapacity(), newCapacity));
        evictOverflow();
        return capacity;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized int capacity() {
        return capacity;
    }

    /** Keys from most to least recently used. */
    public synchronized List<String> keys() {
        List<String> keys = new ArrayList<>(entries.size());
        for (Entry<V> e = head.next; e != tail; e = e.next) {
            keys.add(e.key);
        }
        return keys;
    }

    public synchronized CacheStats stats() {
        return new CacheStats(entries.size(), capacity, hits, misses, evictions, resizes);
    }

    private void recordLookup(boolean hit) {
        windowLookups++;
        if (hit) {
            windowHits++;
        }
        if (windowLookups < policy.checkInterval()) {
            return;
        }
        double rate = (double) windowHits / windowLookups;
        windowHits = 0;
        windowLookups = 0;
        int target = capacity;
        if (rate < policy.lowHitRate()) {
            target = (int) Math.ceil(capacity * policy.growthFactor());
        } else if (rate > policy.highHitRate()) {
            target = (int) Math.floor(capacity * policy.shrinkFactor());
        }
        int before = capacity;
        if (resize(target) != before) {
            resizes++;
            LOG.debug("Match cache resized {} -> {} (window hit rate {})", before, capacity, rate);
        }
    }

    private void evictOverflow() {
        while (entries.size() > capacity) {
            Entry<V> lru = tail.prev;
            unlink(lru);
            entries.remove(lru.key);
            evictions++;
        }
    }

    private void linkFirst(Entry<V> entry) {
        entry.prev = head;
        entry.next = head.next;
        head.next.prev = entry;
        head.next = entry;
    }

    private void unlink(Entry<V> entry) {
        entry.prev.next = entry.next;
        entry.next.prev = entry.prev;
        entry.prev = null;
        entry.next = null;
    }
}
