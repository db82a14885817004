package com.tsl.search.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store behind the search cache. Implementations may throw any runtime exception when the
 * backing store is unreachable; {@link SearchCacheService} turns those into misses.
 */
public interface SearchCacheStore {
    Optional<String> get(String key);

    void set(String key, String payload, Duration ttl);

    /**
     * Deletes every key matching the glob, walking the keyspace with a cursor in batches of
     * {@code scanCount}.
     */
    long deleteMatching(String pattern, int scanCount);

    long countMatching(String pattern, int scanCount);

    CommandStats commandStats();

    String name();

    record CommandStats(long hits, long misses) {
    }
}
