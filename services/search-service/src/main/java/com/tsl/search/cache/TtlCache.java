package com.tsl.search.cache;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Predicate;

/**
 * Bounded TTL map. Expired entries are dropped lazily on read and scan; once full the oldest
 * insertions are evicted first. A re-put key moves to the back of the insertion order.
 */
public class TtlCache<V> {
    private final ConcurrentHashMap<String, CacheEntry<V>> entries = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<Slot<V>> order = new ConcurrentLinkedQueue<>();
    private final int maxEntries;
    private final Clock clock;

    public TtlCache(int maxEntries, Clock clock) {
        this.maxEntries = Math.max(1, maxEntries);
        this.clock = clock;
    }

    public Optional<CacheEntry<V>> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.millis())) {
            if (entries.remove(key, entry)) {
                dequeue(key, entry);
            }
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public void put(String key, V value, long ttlMs) {
        if (key == null || value == null || ttlMs <= 0) {
            return;
        }
        long now = clock.millis();
        CacheEntry<V> entry = new CacheEntry<>(value, now, now + ttlMs);
        CacheEntry<V> previous = entries.put(key, entry);
        if (previous != null) {
            dequeue(key, previous);
        }
        order.add(new Slot<>(key, entry));
        evictIfNeeded();
    }

    public boolean remove(String key) {
        CacheEntry<V> removed = entries.remove(key);
        if (removed == null) {
            return false;
        }
        dequeue(key, removed);
        return true;
    }

    /**
     * Live (unexpired) keys accepted by the filter.
     */
    public List<String> keys(Predicate<String> filter) {
        long now = clock.millis();
        List<String> keys = new ArrayList<>();
        for (Map.Entry<String, CacheEntry<V>> entry : entries.entrySet()) {
            if (entry.getValue().isExpired(now)) {
                if (entries.remove(entry.getKey(), entry.getValue())) {
                    dequeue(entry.getKey(), entry.getValue());
                }
                continue;
            }
            if (filter.test(entry.getKey())) {
                keys.add(entry.getKey());
            }
        }
        return keys;
    }

    int size() {
        return entries.size();
    }

    int trackedSlots() {
        return order.size();
    }

    private void dequeue(String key, CacheEntry<V> entry) {
        order.removeIf(slot -> slot.entry == entry && slot.key.equals(key));
    }

    private void evictIfNeeded() {
        while (entries.size() > maxEntries) {
            Slot<V> slot = order.poll();
            if (slot == null) {
                break;
            }
            // a slot whose entry was replaced or already dropped evicts nothing
            entries.remove(slot.key, slot.entry);
        }
    }

    private static final class Slot<V> {
        private final String key;
        private final CacheEntry<V> entry;

        private Slot(String key, CacheEntry<V> entry) {
            this.key = key;
            this.entry = entry;
        }
    }
}
