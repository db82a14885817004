package com.tsl.search.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Process-local store for single-node runs and tests. Keeps its own keyspace hit/miss counters in
 * place of the ones Redis reports.
 */
public class InMemorySearchCacheStore implements SearchCacheStore {
    private final TtlCache<String> cache;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public InMemorySearchCacheStore(int maxEntries, Clock clock) {
        this.cache = new TtlCache<>(maxEntries, clock);
    }

    @Override
    public Optional<String> get(String key) {
        Optional<String> value = cache.get(key).map(CacheEntry::getValue);
        if (value.isPresent()) {
            hits.incrementAndGet();
        } else {
            misses.incrementAndGet();
        }
        return value;
    }

    @Override
    public void set(String key, String payload, Duration ttl) {
        cache.put(key, payload, ttl.toMillis());
    }

    @Override
    public long deleteMatching(String pattern, int scanCount) {
        long deleted = 0;
        for (String key : matching(pattern)) {
            if (cache.remove(key)) {
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public long countMatching(String pattern, int scanCount) {
        return matching(pattern).size();
    }

    @Override
    public CommandStats commandStats() {
        return new CommandStats(hits.get(), misses.get());
    }

    @Override
    public String name() {
        return "memory";
    }

    private List<String> matching(String pattern) {
        Pattern regex = Pattern.compile(CacheKeyUtil.globToRegex(pattern), Pattern.DOTALL);
        return cache.keys(key -> regex.matcher(key).matches());
    }
}
